package stac.spi;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.smallrye.mutiny.Uni;

import stac.core.model.request.SearchRequest;
import stac.core.model.stac.CollectionList;
import stac.core.model.stac.Item;
import stac.core.model.stac.ItemCollection;
import stac.core.model.stac.Queryables;
import stac.core.model.stac.StacCollection;

@DisplayName("StacBackend")
class StacBackendTest {

    private final StacRequestContext context = StacRequestContext.of("http://testserver/");

    /** Blocking client that records the thread each call ran on. */
    private static final class RecordingCoreClient implements CoreClient {

        private final AtomicReference<Thread> caller = new AtomicReference<>();

        private ItemCollection page() {
            caller.set(Thread.currentThread());
            return ItemCollection.of(List.of(), List.of());
        }

        @Override
        public ItemCollection getSearch(SearchRequest request, StacRequestContext context) {
            return page();
        }

        @Override
        public ItemCollection postSearch(SearchRequest request, StacRequestContext context) {
            return page();
        }

        @Override
        public Item getItem(String collectionId, String itemId, StacRequestContext context) {
            caller.set(Thread.currentThread());
            return new Item(Map.of("type", Item.TYPE, "id", itemId, "collection", collectionId));
        }

        @Override
        public CollectionList allCollections(StacRequestContext context) {
            return new CollectionList(List.of(), List.of());
        }

        @Override
        public StacCollection getCollection(String collectionId, StacRequestContext context) {
            throw new IllegalStateException("unavailable");
        }

        @Override
        public ItemCollection itemCollection(String collectionId, SearchRequest request, StacRequestContext context) {
            return page();
        }
    }

    @Test
    @DisplayName("Should require a core client")
    void shouldRequireCoreClient() {
        assertThrows(StacBackendException.class, () -> StacBackend.blocking(null, null, null));
        assertThrows(StacBackendException.class, () -> StacBackend.async(null, null, null));
    }

    @Test
    @DisplayName("Should run blocking clients off the calling thread")
    void shouldOffloadBlockingCalls() {
        var core = new RecordingCoreClient();
        var backend = StacBackend.blocking(core, null, null);

        var item = backend.core().getItem("c", "i", context).await().indefinitely();

        assertEquals(StacBackend.Family.BLOCKING, backend.family());
        assertEquals("i", item.id());
        assertNotEquals(Thread.currentThread(), core.caller.get());
    }

    @Test
    @DisplayName("Should surface blocking failures through the Uni")
    void shouldPropagateBlockingFailures() {
        var backend = StacBackend.blocking(new RecordingCoreClient(), null, null);

        var lookup = backend.core().getCollection("c", context);

        assertThrows(IllegalStateException.class, () -> lookup.await().indefinitely());
    }

    @Test
    @DisplayName("Should use async clients as given")
    void shouldUseAsyncClients() {
        AsyncCoreClient core = new AsyncCoreClient() {
            @Override
            public Uni<ItemCollection> getSearch(SearchRequest request, StacRequestContext context) {
                return Uni.createFrom().item(ItemCollection.of(List.of(), List.of()));
            }

            @Override
            public Uni<ItemCollection> postSearch(SearchRequest request, StacRequestContext context) {
                return getSearch(request, context);
            }

            @Override
            public Uni<Item> getItem(String collectionId, String itemId, StacRequestContext context) {
                return Uni.createFrom().nullItem();
            }

            @Override
            public Uni<CollectionList> allCollections(StacRequestContext context) {
                return Uni.createFrom().item(new CollectionList(List.of(), List.of()));
            }

            @Override
            public Uni<StacCollection> getCollection(String collectionId, StacRequestContext context) {
                return Uni.createFrom().nullItem();
            }

            @Override
            public Uni<ItemCollection> itemCollection(
                    String collectionId, SearchRequest request, StacRequestContext context) {
                return getSearch(request, context);
            }
        };

        var backend = StacBackend.async(core, null, null);

        assertEquals(StacBackend.Family.ASYNC, backend.family());
        assertSame(core, backend.core());
        assertTrue(backend.transactions().isEmpty());
    }

    @Test
    @DisplayName("Should default to an empty queryables schema")
    void shouldDefaultFilters() {
        var backend = StacBackend.blocking(new RecordingCoreClient(), null, null);

        var schema = backend.filters().getQueryables(null, context).await().indefinitely();

        assertEquals(Queryables.emptySchema(), schema);
    }
}
