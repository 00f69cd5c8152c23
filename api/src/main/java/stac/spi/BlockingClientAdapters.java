package stac.spi;

import java.util.Map;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;

import stac.core.model.request.SearchRequest;
import stac.core.model.stac.CollectionList;
import stac.core.model.stac.Item;
import stac.core.model.stac.ItemCollection;
import stac.core.model.stac.StacCollection;

/**
 * Adapts blocking clients to the non-blocking contracts by running each call on the worker pool.
 */
final class BlockingClientAdapters {

    private BlockingClientAdapters() {}

    private static <T> Uni<T> offload(Supplier<T> call) {
        return Uni.createFrom().item(call).runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    static final class Core implements AsyncCoreClient {

        private final CoreClient delegate;

        Core(CoreClient delegate) {
            this.delegate = delegate;
        }

        @Override
        public Uni<ItemCollection> getSearch(SearchRequest request, StacRequestContext context) {
            return offload(() -> delegate.getSearch(request, context));
        }

        @Override
        public Uni<ItemCollection> postSearch(SearchRequest request, StacRequestContext context) {
            return offload(() -> delegate.postSearch(request, context));
        }

        @Override
        public Uni<Item> getItem(String collectionId, String itemId, StacRequestContext context) {
            return offload(() -> delegate.getItem(collectionId, itemId, context));
        }

        @Override
        public Uni<CollectionList> allCollections(StacRequestContext context) {
            return offload(() -> delegate.allCollections(context));
        }

        @Override
        public Uni<StacCollection> getCollection(String collectionId, StacRequestContext context) {
            return offload(() -> delegate.getCollection(collectionId, context));
        }

        @Override
        public Uni<ItemCollection> itemCollection(
                String collectionId, SearchRequest request, StacRequestContext context) {
            return offload(() -> delegate.itemCollection(collectionId, request, context));
        }
    }

    static final class Transactions implements AsyncTransactionsClient {

        private final TransactionsClient delegate;

        Transactions(TransactionsClient delegate) {
            this.delegate = delegate;
        }

        @Override
        public Uni<Item> createItem(String collectionId, Item item, StacRequestContext context) {
            return offload(() -> delegate.createItem(collectionId, item, context));
        }

        @Override
        public Uni<Void> createItems(String collectionId, ItemCollection items, StacRequestContext context) {
            return offload(() -> {
                delegate.createItems(collectionId, items, context);
                return null;
            });
        }

        @Override
        public Uni<Item> updateItem(String collectionId, String itemId, Item item, StacRequestContext context) {
            return offload(() -> delegate.updateItem(collectionId, itemId, item, context));
        }

        @Override
        public Uni<Item> deleteItem(String collectionId, String itemId, StacRequestContext context) {
            return offload(() -> delegate.deleteItem(collectionId, itemId, context));
        }

        @Override
        public Uni<StacCollection> createCollection(StacCollection collection, StacRequestContext context) {
            return offload(() -> delegate.createCollection(collection, context));
        }

        @Override
        public Uni<StacCollection> updateCollection(
                String collectionId, StacCollection collection, StacRequestContext context) {
            return offload(() -> delegate.updateCollection(collectionId, collection, context));
        }

        @Override
        public Uni<StacCollection> deleteCollection(String collectionId, StacRequestContext context) {
            return offload(() -> delegate.deleteCollection(collectionId, context));
        }
    }

    static final class Filters implements AsyncFiltersClient {

        private final FiltersClient delegate;

        Filters(FiltersClient delegate) {
            this.delegate = delegate;
        }

        @Override
        public Uni<Map<String, Object>> getQueryables(String collectionId, StacRequestContext context) {
            return offload(() -> delegate.getQueryables(collectionId, context));
        }
    }
}
