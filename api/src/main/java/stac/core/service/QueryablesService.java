package stac.core.service;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import stac.core.model.common.FeatureDisabledException;
import stac.core.model.extension.ExtensionType;
import stac.core.port.in.QueryablesUseCase;
import stac.core.port.out.BackendMetrics;
import stac.core.service.common.BackendCalls;
import stac.spi.StacBackend;
import stac.spi.StacRequestContext;

/**
 * Serves queryables from the backend's filters client while the Filter extension is enabled.
 */
@ApplicationScoped
public class QueryablesService implements QueryablesUseCase {

    private final StacBackend backend;
    private final ExtensionRegistry registry;
    private final BackendMetrics metrics;

    @Inject
    public QueryablesService(StacBackend backend, ExtensionRegistry registry, BackendMetrics metrics) {
        this.backend = backend;
        this.registry = registry;
        this.metrics = metrics;
    }

    @Override
    public Uni<Map<String, Object>> getQueryables(String collectionId, StacRequestContext context) {
        if (!registry.isEnabled(ExtensionType.FILTER)) {
            return Uni.createFrom().failure(new FeatureDisabledException(ExtensionType.FILTER.typeName()));
        }
        return BackendCalls.observe(
                metrics, "getQueryables", () -> backend.filters().getQueryables(collectionId, context));
    }
}
