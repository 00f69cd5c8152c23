package stac.core.model.forwarding;

/**
 * A single raw request header. Header lists keep arrival order and may repeat names.
 *
 * @param name  header name as received
 * @param value header value as received
 */
public record Header(String name, String value) {

    public Header {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Header name cannot be null or blank");
        }
        if (value == null) {
            value = "";
        }
    }

    public boolean hasName(String other) {
        return name.equalsIgnoreCase(other);
    }
}
