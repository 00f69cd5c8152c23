package stac.core.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import stac.core.model.common.FeatureDisabledException;
import stac.core.model.extension.ExtensionType;
import stac.core.model.stac.Item;
import stac.core.model.stac.ItemCollection;
import stac.core.model.stac.StacCollection;
import stac.core.port.in.TransactionManagement;
import stac.core.port.out.BackendMetrics;
import stac.core.service.common.BackendCalls;
import stac.spi.AsyncTransactionsClient;
import stac.spi.StacBackend;
import stac.spi.StacRequestContext;

/**
 * Routes transaction calls to the backend's transactions client when the Transaction extension
 * is enabled.
 */
@ApplicationScoped
public class TransactionService implements TransactionManagement {

    private static final Logger LOG = Logger.getLogger(TransactionService.class);

    private final StacBackend backend;
    private final BackendMetrics metrics;
    private final boolean enabled;

    @Inject
    public TransactionService(StacBackend backend, ExtensionRegistry registry, BackendMetrics metrics) {
        this.backend = backend;
        this.metrics = metrics;
        var extensionEnabled = registry.isEnabled(ExtensionType.TRANSACTION);
        this.enabled = extensionEnabled && backend.transactions().isPresent();
        if (extensionEnabled && !enabled) {
            LOG.warn("Transaction extension is enabled but the backend has no transactions client");
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public Uni<Item> createItem(String collectionId, Map<String, Object> body, StacRequestContext context) {
        var type = body == null ? null : body.get("type");
        if (ItemCollection.TYPE.equals(type)) {
            return Uni.createFrom()
                    .item(() -> toItemCollection(body))
                    .chain(items -> call("createItems", client -> client.createItems(collectionId, items, context)))
                    .map(ignored -> (Item) null);
        }
        if (Item.TYPE.equals(type)) {
            var item = new Item(body);
            return call("createItem", client -> client.createItem(collectionId, item, context));
        }
        return Uni.createFrom()
                .failure(new IllegalArgumentException("Body must be a GeoJSON Feature or FeatureCollection"));
    }

    @Override
    public Uni<Item> updateItem(String collectionId, String itemId, Item item, StacRequestContext context) {
        return call("updateItem", client -> client.updateItem(collectionId, itemId, item, context));
    }

    @Override
    public Uni<Item> deleteItem(String collectionId, String itemId, StacRequestContext context) {
        return call("deleteItem", client -> client.deleteItem(collectionId, itemId, context));
    }

    @Override
    public Uni<StacCollection> createCollection(StacCollection collection, StacRequestContext context) {
        return call("createCollection", client -> client.createCollection(collection, context));
    }

    @Override
    public Uni<StacCollection> updateCollection(
            String collectionId, StacCollection collection, StacRequestContext context) {
        return call("updateCollection", client -> client.updateCollection(collectionId, collection, context));
    }

    @Override
    public Uni<StacCollection> deleteCollection(String collectionId, StacRequestContext context) {
        return call("deleteCollection", client -> client.deleteCollection(collectionId, context));
    }

    private <T> Uni<T> call(String operation, Function<AsyncTransactionsClient, Uni<T>> invocation) {
        if (!enabled) {
            return Uni.createFrom().failure(new FeatureDisabledException(ExtensionType.TRANSACTION.typeName()));
        }
        var client = backend.transactions().orElseThrow();
        return BackendCalls.observe(metrics, operation, () -> invocation.apply(client));
    }

    @SuppressWarnings("unchecked")
    private static ItemCollection toItemCollection(Map<String, Object> body) {
        if (!(body.get("features") instanceof List<?> features)) {
            throw new IllegalArgumentException("FeatureCollection must have a 'features' array");
        }
        var items = new ArrayList<Item>();
        for (var feature : features) {
            if (!(feature instanceof Map<?, ?> document)) {
                throw new IllegalArgumentException("FeatureCollection features must be objects");
            }
            items.add(new Item((Map<String, Object>) document));
        }
        return ItemCollection.of(items, List.of());
    }
}
