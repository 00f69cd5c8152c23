package stac.adapter.out.storage.memory;

import stac.spi.StacBackend;
import stac.spi.StacBackendConfig;
import stac.spi.StacBackendProvider;

/**
 * Default in-memory backend provider.
 *
 * <p>Data is NOT persisted across restarts. Intended for development, tests and demos.
 */
public class InMemoryStacBackendProvider implements StacBackendProvider {

    static final String TRANSACTIONS_KEY = "memory.transactions";

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory catalog (non-persistent)";
    }

    @Override
    public int priority() {
        return 0;
    }

    /**
     * Builds a fresh catalog. Setting {@code memory.transactions=false} makes the backend
     * read-only.
     */
    @Override
    public StacBackend create(StacBackendConfig config) {
        var catalog = new InMemoryCatalog();
        var writable = config.getBoolean(TRANSACTIONS_KEY).orElse(true);
        return StacBackend.blocking(catalog, writable ? catalog : null, null);
    }
}
