package stac.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import stac.adapter.out.storage.StacBackendLoader;
import stac.core.service.ExtensionRegistry;
import stac.spi.StacBackend;

/**
 * Readiness check reporting the selected backend and the enabled extensions.
 *
 * <p>Always UP once the backend has been created; backend selection failures abort startup.
 */
@Readiness
@ApplicationScoped
public class StacBackendHealthCheck implements HealthCheck {

    private final StacBackendLoader loader;
    private final StacBackend backend;
    private final ExtensionRegistry registry;

    @Inject
    public StacBackendHealthCheck(StacBackendLoader loader, StacBackend backend, ExtensionRegistry registry) {
        this.loader = loader;
        this.backend = backend;
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.builder()
                .name("stac-backend")
                .withData("provider", loader.provider().name())
                .withData("clients", backend.family().name().toLowerCase())
                .withData("transactions", backend.transactions().isPresent())
                .withData(
                        "extensions",
                        String.join(
                                ",",
                                registry.extensions().stream()
                                        .map(e -> e.type().configName())
                                        .toList()))
                .up()
                .build();
    }
}
