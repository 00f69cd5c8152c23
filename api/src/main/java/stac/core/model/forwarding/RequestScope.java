package stac.core.model.forwarding;

import java.util.List;

/**
 * The connection-level view of an incoming request, before any proxy headers are applied.
 *
 * @param scheme     the scheme the server was reached with (http/https)
 * @param serverHost the host the server is bound to / was addressed as
 * @param serverPort the port the server was reached on, or null if unknown
 * @param headers    raw request headers in arrival order
 */
public record RequestScope(String scheme, String serverHost, Integer serverPort, List<Header> headers) {

    public RequestScope {
        if (scheme == null || scheme.isBlank()) {
            scheme = "http";
        }
        headers = headers == null ? List.of() : List.copyOf(headers);
    }
}
