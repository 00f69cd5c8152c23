package stac.spi;

/**
 * Exception thrown when a backend provider cannot be selected or fails to initialize.
 */
public class StacBackendException extends RuntimeException {

    public StacBackendException(String message) {
        super(message);
    }

    public StacBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
