package stac.core.model.forwarding;

/**
 * Externally visible URL components of a request, as reconstructed from proxy headers.
 *
 * @param scheme     external scheme
 * @param host       external host name
 * @param port       external port, or null when the client did not address one explicitly
 * @param pathPrefix path prefix the proxy mounts the service under, or null
 */
public record ForwardedUrlParts(String scheme, String host, Integer port, String pathPrefix) {

    /**
     * Render the origin plus prefix as an absolute base URL ending in {@code /}.
     *
     * <p>Default ports (80 for http, 443 for https) are omitted.
     *
     * @param rootPath the application root path below the prefix, may be null
     * @return the base URL
     */
    public String toBaseUrl(String rootPath) {
        var sb = new StringBuilder();
        sb.append(scheme).append("://").append(host);
        if (port != null && !isDefaultPort()) {
            sb.append(':').append(port);
        }
        appendPath(sb, pathPrefix);
        appendPath(sb, rootPath);
        if (sb.charAt(sb.length() - 1) != '/') {
            sb.append('/');
        }
        return sb.toString();
    }

    private boolean isDefaultPort() {
        return ("http".equalsIgnoreCase(scheme) && port == 80) || ("https".equalsIgnoreCase(scheme) && port == 443);
    }

    private static void appendPath(StringBuilder sb, String path) {
        if (path == null || path.isEmpty() || "/".equals(path)) {
            return;
        }
        if (sb.charAt(sb.length() - 1) == '/') {
            sb.setLength(sb.length() - 1);
        }
        if (!path.startsWith("/")) {
            sb.append('/');
        }
        sb.append(path);
    }
}
