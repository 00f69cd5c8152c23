package stac.adapter.out.storage;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.Config;

import stac.spi.StacBackendConfig;

/**
 * {@link StacBackendConfig} backed by MicroProfile Config.
 *
 * <p>Keys are resolved below the {@code stac.backend.} namespace, so a provider asking for
 * {@code memory.transactions} reads {@code stac.backend.memory.transactions}.
 */
@ApplicationScoped
public class MicroProfileStacBackendConfig implements StacBackendConfig {

    static final String NAMESPACE = "stac.backend.";

    private final Config config;

    @Inject
    public MicroProfileStacBackendConfig(Config config) {
        this.config = config;
    }

    @Override
    public String getRequired(String key) {
        return get(key).orElseThrow(() -> new IllegalStateException("Missing backend setting: " + NAMESPACE + key));
    }

    @Override
    public Optional<String> get(String key) {
        return config.getOptionalValue(NAMESPACE + key, String.class);
    }

    @Override
    public String getOrDefault(String key, String defaultValue) {
        return get(key).orElse(defaultValue);
    }

    @Override
    public Map<String, String> getWithPrefix(String prefix) {
        var qualified = NAMESPACE + prefix;
        Map<String, String> result = new TreeMap<>();
        for (String name : config.getPropertyNames()) {
            if (name.startsWith(qualified)) {
                var relative = name.substring(NAMESPACE.length());
                get(relative).ifPresent(value -> result.put(relative, value));
            }
        }
        return result;
    }

    @Override
    public Optional<Integer> getInt(String key) {
        return config.getOptionalValue(NAMESPACE + key, Integer.class);
    }

    @Override
    public Optional<Boolean> getBoolean(String key) {
        return config.getOptionalValue(NAMESPACE + key, Boolean.class);
    }
}
