package stac.config;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * CORS configuration mapping.
 *
 * <p>Configuration prefix: {@code stac.cors}
 */
@ConfigMapping(prefix = "stac.cors")
public interface CorsConfigMapping {

    /**
     * Enable CORS handling.
     *
     * @return true if CORS is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Allowed origins. Use "*" to allow all origins; wildcard subdomains like "*.example.com"
     * are supported.
     *
     * @return allowed origins (default: *)
     */
    @WithDefault("*")
    List<String> allowedOrigins();

    @WithDefault("GET,POST,PUT,DELETE,OPTIONS,HEAD")
    Set<String> allowedMethods();

    /**
     * Allowed request headers. Use "*" to allow all headers.
     */
    @WithDefault("*")
    Set<String> allowedHeaders();

    Optional<Set<String>> exposedHeaders();

    /**
     * Allow credentials. When true, the request origin is echoed instead of "*".
     */
    @WithDefault("false")
    boolean allowCredentials();

    /**
     * Max age for the preflight cache in seconds.
     *
     * @return max age (default: 86400)
     */
    @WithDefault("86400")
    Optional<Long> maxAge();
}
