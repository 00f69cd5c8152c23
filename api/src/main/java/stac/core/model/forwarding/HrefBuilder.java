package stac.core.model.forwarding;

import java.net.URI;

/**
 * Builds absolute hrefs for links in responses from a per-request base URL.
 *
 * <p>Relative paths are always resolved below the base URL: a leading {@code /} or
 * {@code ./} does not escape a proxy path prefix.
 */
public final class HrefBuilder {

    private final String baseUrl;

    private HrefBuilder(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    /**
     * Create a builder for the given base URL.
     *
     * @param baseUrl absolute URL with scheme and host
     * @return the builder
     * @throws IllegalArgumentException if the URL is not absolute or lacks a host
     */
    public static HrefBuilder of(String baseUrl) {
        if (baseUrl == null) {
            throw new IllegalArgumentException("Base URL is required");
        }
        URI uri;
        try {
            uri = URI.create(baseUrl);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid base URL: " + baseUrl, e);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalArgumentException("Base URL must have a scheme and host: " + baseUrl);
        }
        return new HrefBuilder(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");
    }

    public static HrefBuilder of(ForwardedUrlParts parts, String rootPath) {
        return of(parts.toBaseUrl(rootPath));
    }

    public String baseUrl() {
        return baseUrl;
    }

    /**
     * Build an absolute href.
     *
     * @param relativePath path below the base URL, e.g. {@code collections/foo}
     * @return the absolute URL
     */
    public String build(String relativePath) {
        if (relativePath == null) {
            return baseUrl;
        }
        var path = relativePath;
        while (path.startsWith("./")) {
            path = path.substring(2);
        }
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        if (path.equals(".")) {
            path = "";
        }
        return baseUrl + path;
    }

    @Override
    public String toString() {
        return "HrefBuilder[" + baseUrl + "]";
    }
}
