package stac.core.model.request;

/**
 * HTTP methods that carry a composed request model.
 */
public enum RequestMethod {
    GET(ParameterKind.QUERY),
    POST(ParameterKind.BODY);

    private final ParameterKind kind;

    RequestMethod(ParameterKind kind) {
        this.kind = kind;
    }

    /**
     * The parameter kind a model bound to this method is expected to have.
     */
    public ParameterKind kind() {
        return kind;
    }
}
