package stac.core.model.request;

/**
 * Raised at startup when request models cannot be composed from the configured extensions.
 *
 * <p>This is a configuration error: it is never mapped to a client response.
 */
public class RequestModelCompositionException extends RuntimeException {

    public RequestModelCompositionException(String message) {
        super(message);
    }
}
