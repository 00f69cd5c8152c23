package stac.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import stac.spi.StacBackend;
import stac.spi.StacBackendConfig;
import stac.spi.StacBackendException;
import stac.spi.StacBackendProvider;

/**
 * Discovers backend providers via ServiceLoader and produces the {@link StacBackend} bean.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If stac.backend.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class StacBackendLoader {

    private static final Logger LOG = Logger.getLogger(StacBackendLoader.class);

    private final Optional<String> configuredProvider;
    private final StacBackendConfig config;

    private StacBackendProvider provider;

    @Inject
    public StacBackendLoader(
            @ConfigProperty(name = "stac.backend.provider") Optional<String> configuredProvider,
            StacBackendConfig config) {
        this.configuredProvider = configuredProvider;
        this.config = config;
    }

    @Produces
    @Singleton
    public StacBackend backend() {
        var selected = provider();
        LOG.infof("Creating STAC backend from provider: %s (%s)", selected.name(), selected.description());
        var backend = selected.create(config);
        if (backend == null) {
            throw new StacBackendException("Provider " + selected.name() + " returned no backend");
        }
        LOG.infof("STAC backend ready: %s clients, transactions %s",
                backend.family().name().toLowerCase(),
                backend.transactions().isPresent() ? "supported" : "not supported");
        return backend;
    }

    /**
     * The selected provider, resolved on first use.
     */
    public synchronized StacBackendProvider provider() {
        if (provider != null) {
            return provider;
        }

        List<StacBackendProvider> providers = new ArrayList<>();
        ServiceLoader.load(StacBackendProvider.class).forEach(providers::add);

        if (providers.isEmpty()) {
            throw new StacBackendException(
                    "No STAC backend providers found. Ensure a provider JAR is on the classpath.");
        }

        LOG.infof(
                "Found %d backend provider(s): %s",
                providers.size(),
                providers.stream().map(StacBackendProvider::name).toList());

        provider = select(providers, configuredProvider.orElse(null));
        return provider;
    }

    static StacBackendProvider select(List<StacBackendProvider> providers, String configured) {
        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new StacBackendException("Configured backend provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(StacBackendProvider::name).toList()));
        }

        return providers.stream()
                .filter(StacBackendProvider::isAvailable)
                .max(Comparator.comparingInt(StacBackendProvider::priority))
                .orElseThrow(() -> new StacBackendException("No available backend providers"));
    }
}
