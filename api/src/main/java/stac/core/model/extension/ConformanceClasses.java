package stac.core.model.extension;

import java.util.List;

/**
 * Conformance class URIs advertised at {@code /conformance}.
 */
public final class ConformanceClasses {

    public static final String STAC_CORE = "https://api.stacspec.org/v1.0.0-rc.1/core";
    public static final String STAC_OGCAPI_FEATURES = "https://api.stacspec.org/v1.0.0-rc.1/ogcapi-features";
    public static final String STAC_COLLECTIONS = "https://api.stacspec.org/v1.0.0-rc.1/collections";
    public static final String STAC_ITEM_SEARCH = "https://api.stacspec.org/v1.0.0-rc.1/item-search";

    public static final String OAF_CORE = "http://www.opengis.net/spec/ogcapi-features-1/1.0/conf/core";
    public static final String OAF_OPEN_API = "http://www.opengis.net/spec/ogcapi-features-1/1.0/conf/oas30";
    public static final String OAF_GEOJSON = "http://www.opengis.net/spec/ogcapi-features-1/1.0/conf/geojson";

    public static final String FILTER = "http://www.opengis.net/spec/ogcapi-features-3/1.0/conf/filter";
    public static final String FEATURES_FILTER =
            "http://www.opengis.net/spec/ogcapi-features-3/1.0/conf/features-filter";
    public static final String ITEM_SEARCH_FILTER = "https://api.stacspec.org/v1.0.0-rc.1/item-search#filter";
    public static final String BASIC_CQL2 = "http://www.opengis.net/spec/cql2/1.0/conf/basic-cql2";
    public static final String CQL2_JSON = "http://www.opengis.net/spec/cql2/1.0/conf/cql2-json";

    public static final String CRS = "http://www.opengis.net/spec/ogcapi-features-2/1.0/conf/crs";

    public static final String TRANSACTION =
            "https://api.stacspec.org/v1.0.0-rc.2/ogcapi-features/extensions/transaction";
    public static final String SIMPLE_TRANSACTION = "http://www.opengis.net/spec/ogcapi-features-4/1.0/conf/simpletx";

    public static final List<String> BASE = List.of(
            STAC_CORE, STAC_OGCAPI_FEATURES, STAC_COLLECTIONS, STAC_ITEM_SEARCH, OAF_CORE, OAF_OPEN_API, OAF_GEOJSON);

    private ConformanceClasses() {}
}
