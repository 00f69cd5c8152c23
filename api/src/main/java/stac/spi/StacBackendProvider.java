package stac.spi;

/**
 * Service Provider Interface for STAC backends.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} at startup.
 *
 * <h2>How to Create a Custom Backend</h2>
 * <ol>
 *   <li>Implement {@link CoreClient} (blocking) or {@link AsyncCoreClient} (non-blocking), and
 *       optionally the matching transactions and filters clients of the same family</li>
 *   <li>Implement this interface and return them from {@link #create} via
 *       {@link StacBackend#blocking} or {@link StacBackend#async}</li>
 *   <li>Create META-INF/services/stac.spi.StacBackendProvider listing your class</li>
 *   <li>Configure: stac.backend.provider=your-provider-name</li>
 * </ol>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * public class PgStacBackendProvider implements StacBackendProvider {
 *     @Override
 *     public String name() { return "pgstac"; }
 *
 *     @Override
 *     public StacBackend create(StacBackendConfig config) {
 *         var dsn = config.getRequired("stac.backend.pgstac.dsn");
 *         return StacBackend.blocking(new PgStacCoreClient(dsn), null, null);
 *     }
 * }
 * }</pre>
 */
public interface StacBackendProvider {

    /**
     * Unique name identifying this provider, matched against {@code stac.backend.provider}.
     */
    String name();

    default String description() {
        return name() + " STAC backend";
    }

    /**
     * Priority for auto-selection when no explicit provider is configured.
     *
     * <p>Higher values win. The built-in in-memory backend uses 0.
     *
     * @return the provider priority
     */
    default int priority() {
        return 0;
    }

    /**
     * Check if this provider can be used (dependencies present, etc.).
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Create the backend. Called once at startup; the returned clients must be thread-safe.
     *
     * @param config access to configuration properties
     * @return the backend
     * @throws StacBackendException if initialization fails
     */
    StacBackend create(StacBackendConfig config);
}
