package stac.core.model.request;

/**
 * Value types a request field can hold after binding.
 */
public enum FieldType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    /** List of strings; comma-separated in query strings, a JSON array in bodies. */
    STRING_LIST,
    /** Four or six coordinates. */
    BBOX,
    /** RFC 3339 instant or interval, bound to {@link DatetimeInterval}. */
    DATETIME,
    /** Arbitrary JSON value; kept as raw text in query strings. */
    JSON
}
