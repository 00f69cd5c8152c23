package stac.core.model.common;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Cross-origin policy applied to every route.
 */
public record CorsPolicy(
        List<String> allowedOrigins,
        Set<String> allowedMethods,
        Set<String> allowedHeaders,
        Set<String> exposedHeaders,
        boolean allowCredentials,
        Optional<Long> maxAge) {

    public CorsPolicy {
        allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
        allowedMethods = allowedMethods == null ? Set.of() : Set.copyOf(allowedMethods);
        allowedHeaders = allowedHeaders == null ? Set.of() : Set.copyOf(allowedHeaders);
        exposedHeaders = exposedHeaders == null ? Set.of() : Set.copyOf(exposedHeaders);
        maxAge = maxAge == null ? Optional.empty() : maxAge;
    }

    public boolean isOriginAllowed(String origin) {
        if (origin == null || origin.isBlank()) {
            return false;
        }
        if (allowedOrigins.contains("*")) {
            return true;
        }
        return allowedOrigins.stream().anyMatch(allowed -> matchesOrigin(allowed, origin));
    }

    public boolean isMethodAllowed(String method) {
        if (method == null || method.isBlank()) {
            return false;
        }
        return allowedMethods.contains("*") || allowedMethods.contains(method.toUpperCase());
    }

    /**
     * Value for {@code Access-Control-Allow-Origin}: "*" when any origin is allowed without
     * credentials, otherwise the request origin.
     */
    public String allowOriginValue(String origin) {
        return allowedOrigins.contains("*") && !allowCredentials ? "*" : origin;
    }

    public String allowedMethodsHeader() {
        if (allowedMethods.contains("*")) {
            return "GET, POST, PUT, DELETE, OPTIONS, HEAD";
        }
        return String.join(", ", allowedMethods.stream().sorted().toList());
    }

    public String allowedHeadersHeader() {
        if (allowedHeaders.contains("*")) {
            return "*";
        }
        return String.join(", ", allowedHeaders.stream().sorted().toList());
    }

    private static boolean matchesOrigin(String pattern, String origin) {
        if (pattern.equals(origin)) {
            return true;
        }
        // *.example.com matches subdomains only
        if (pattern.startsWith("*.")) {
            return origin.endsWith("." + pattern.substring(2));
        }
        return false;
    }
}
