package stac.core.model.common;

/**
 * Media types used in STAC responses and links.
 */
public final class MediaTypes {

    public static final String JSON = "application/json";
    public static final String GEOJSON = "application/geo+json";
    public static final String JSON_SCHEMA = "application/schema+json";
    public static final String OPENAPI = "application/vnd.oai.openapi+json;version=3.0";
    public static final String HTML = "text/html";

    private MediaTypes() {}
}
