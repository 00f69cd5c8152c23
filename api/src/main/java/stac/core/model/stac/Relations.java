package stac.core.model.stac;

/**
 * Link relation types used by this API.
 */
public final class Relations {

    public static final String SELF = "self";
    public static final String ROOT = "root";
    public static final String PARENT = "parent";
    public static final String CHILD = "child";
    public static final String DATA = "data";
    public static final String CONFORMANCE = "conformance";
    public static final String SEARCH = "search";
    public static final String NEXT = "next";
    public static final String COLLECTION = "collection";
    public static final String ITEMS = "items";
    public static final String QUERYABLES = "http://www.opengis.net/def/rel/ogc/1.0/queryables";
    public static final String SERVICE_DESC = "service-desc";
    public static final String SERVICE_DOC = "service-doc";

    private Relations() {}
}
