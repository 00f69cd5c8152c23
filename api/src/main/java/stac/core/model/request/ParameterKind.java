package stac.core.model.request;

/**
 * Where the fields of a parameter set are read from.
 */
public enum ParameterKind {
    /** Query-string parameters, used by GET routes. */
    QUERY,
    /** Top-level members of a JSON request body, used by POST routes. */
    BODY
}
