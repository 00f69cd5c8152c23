package stac.core.model.extension;

import java.util.Set;

/**
 * Coordinate reference systems accepted by the CRS and Filter extensions.
 */
public final class CrsUris {

    public static final String CRS84 = "http://www.opengis.net/def/crs/OGC/1.3/CRS84";
    public static final String EPSG_25832 = "http://www.opengis.net/def/crs/EPSG/0/25832";

    public static final Set<String> SUPPORTED = Set.of(CRS84, EPSG_25832);

    private CrsUris() {}
}
