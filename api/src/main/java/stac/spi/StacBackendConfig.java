package stac.spi;

import java.util.Map;
import java.util.Optional;

/**
 * Configuration access for backend providers.
 *
 * <p>Providers read their settings through this interface without coupling to a specific
 * configuration framework. Keys are relative to the backend namespace ({@code stac.backend.}).
 */
public interface StacBackendConfig {

    /**
     * Get a required configuration value.
     *
     * @param key the configuration key
     * @return the configuration value
     * @throws IllegalStateException if not configured
     */
    String getRequired(String key);

    Optional<String> get(String key);

    String getOrDefault(String key, String defaultValue);

    /**
     * Get all configuration properties with the given prefix.
     *
     * @param prefix the configuration key prefix
     * @return matching key-value pairs
     */
    Map<String, String> getWithPrefix(String prefix);

    Optional<Integer> getInt(String key);

    Optional<Boolean> getBoolean(String key);
}
