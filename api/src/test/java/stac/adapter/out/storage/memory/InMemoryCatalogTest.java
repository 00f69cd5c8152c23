package stac.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import stac.core.model.common.ResourceConflictException;
import stac.core.model.common.ResourceNotFoundException;
import stac.core.model.request.RequestModel;
import stac.core.model.request.SearchParameterSets;
import stac.core.model.request.SearchRequest;
import stac.core.model.stac.Item;
import stac.core.model.stac.ItemCollection;
import stac.core.model.stac.Link;
import stac.core.model.stac.Relations;
import stac.core.model.stac.StacCollection;
import stac.core.service.RequestModelBinder;
import stac.core.service.RequestModelComposer;
import stac.spi.StacRequestContext;

@DisplayName("InMemoryCatalog")
class InMemoryCatalogTest {

    private static final RequestModel GET_MODEL =
            RequestModelComposer.searchGetModel(SearchParameterSets.BASE_SEARCH_GET, List.of());
    private static final RequestModel POST_MODEL =
            RequestModelComposer.searchPostModel(SearchParameterSets.BASE_SEARCH_POST, List.of());

    private final StacRequestContext context = StacRequestContext.of("http://testserver/");

    private InMemoryCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new InMemoryCatalog();
        catalog.createCollection(collection("landsat"), context);
        catalog.createCollection(collection("sentinel"), context);
        catalog.createItem("landsat", item("l1", List.of(0, 0, 10, 10), "2020-06-01T00:00:00Z"), context);
        catalog.createItem("landsat", item("l2", List.of(20, 20, 30, 30), "2021-06-01T00:00:00Z"), context);
        catalog.createItem("sentinel", item("s1", List.of(5, 5, 15, 15), "2022-06-01T00:00:00Z"), context);
    }

    private static StacCollection collection(String id) {
        return new StacCollection(Map.of("type", "Collection", "id", id, "title", id.toUpperCase()));
    }

    private static Item item(String id, List<Integer> bbox, String datetime) {
        return new Item(Map.of(
                "type", Item.TYPE,
                "id", id,
                "bbox", bbox,
                "properties", Map.of("datetime", datetime)));
    }

    private static SearchRequest query(Map<String, List<String>> params) {
        return RequestModelBinder.bindQuery(GET_MODEL, params);
    }

    private static List<String> ids(ItemCollection page) {
        return page.features().stream().map(Item::id).toList();
    }

    private static Link link(List<Link> links, String rel) {
        return links.stream().filter(l -> l.rel().equals(rel)).findFirst().orElse(null);
    }

    @Nested
    @DisplayName("Search")
    class SearchTests {

        @Test
        @DisplayName("Should return every item in id order without filters")
        void shouldReturnAll() {
            var page = catalog.getSearch(query(Map.of()), context);

            assertEquals(List.of("l1", "l2", "s1"), ids(page));
            assertEquals(3, page.numberMatched());
            assertEquals(3, page.numberReturned());
            assertNull(link(page.links(), Relations.NEXT));
        }

        @Test
        @DisplayName("Should filter by collections and ids")
        void shouldFilterByCollectionsAndIds() {
            var byCollection = catalog.getSearch(query(Map.of("collections", List.of("sentinel"))), context);
            var byId = catalog.getSearch(query(Map.of("ids", List.of("l2,missing"))), context);

            assertEquals(List.of("s1"), ids(byCollection));
            assertEquals(List.of("l2"), ids(byId));
        }

        @Test
        @DisplayName("Should filter by intersecting bbox")
        void shouldFilterByBbox() {
            var page = catalog.getSearch(query(Map.of("bbox", List.of("8,8,12,12"))), context);

            assertEquals(List.of("l1", "s1"), ids(page));
        }

        @Test
        @DisplayName("Should compare the horizontal axes of a 3D bbox")
        void shouldFilterBy3dBbox() {
            var page = catalog.getSearch(query(Map.of("bbox", List.of("25,25,-100,40,40,100"))), context);

            assertEquals(List.of("l2"), ids(page));
        }

        @Test
        @DisplayName("Should filter by datetime interval")
        void shouldFilterByDatetime() {
            var page = catalog.getSearch(
                    query(Map.of("datetime", List.of("2021-01-01T00:00:00Z/.."))), context);

            assertEquals(List.of("l2", "s1"), ids(page));
        }

        @Test
        @DisplayName("Should match items with a start and end datetime by overlap")
        void shouldMatchRanges() {
            catalog.createItem(
                    "sentinel",
                    new Item(Map.of(
                            "type", Item.TYPE,
                            "id", "s2",
                            "properties",
                            Map.of(
                                    "start_datetime", "2019-01-01T00:00:00Z",
                                    "end_datetime", "2019-12-31T00:00:00Z"))),
                    context);

            var page = catalog.getSearch(
                    query(Map.of("datetime", List.of("2019-06-01T00:00:00Z/2019-07-01T00:00:00Z"))), context);

            assertEquals(List.of("s2"), ids(page));
        }

        @Test
        @DisplayName("Should link items to their collection")
        void shouldLinkItems() {
            var item = catalog.getSearch(query(Map.of("ids", List.of("s1"))), context).features().get(0);

            @SuppressWarnings("unchecked")
            var links = (List<Link>) item.document().get("links");
            assertEquals("http://testserver/collections/sentinel/items/s1", link(links, Relations.SELF).href());
            assertEquals("http://testserver/collections/sentinel", link(links, Relations.COLLECTION).href());
            assertEquals("sentinel", item.collection());
        }
    }

    @Nested
    @DisplayName("Paging")
    class PagingTests {

        @Test
        @DisplayName("Should link to the next GET page with the search parameters")
        void shouldLinkNextGetPage() {
            var first = catalog.getSearch(
                    query(Map.of("collections", List.of("landsat,sentinel"), "limit", List.of("2"))), context);

            assertEquals(List.of("l1", "l2"), ids(first));
            assertEquals(3, first.numberMatched());
            var next = link(first.links(), Relations.NEXT);
            assertEquals(
                    "http://testserver/search?collections=landsat%2Csentinel&limit=2&pt=" + PageToken.encode(2),
                    next.href());

            var second = catalog.getSearch(
                    query(Map.of(
                            "collections", List.of("landsat,sentinel"),
                            "limit", List.of("2"),
                            "pt", List.of(PageToken.encode(2)))),
                    context);
            assertEquals(List.of("s1"), ids(second));
            assertNull(link(second.links(), Relations.NEXT));
        }

        @Test
        @DisplayName("Should link to the next POST page with a merge body")
        void shouldLinkNextPostPage() {
            var first = catalog.postSearch(RequestModelBinder.bindBody(POST_MODEL, Map.of("limit", 1)), context);

            var next = link(first.links(), Relations.NEXT);
            assertEquals("POST", next.method());
            assertEquals(Map.of("pt", PageToken.encode(1)), next.body());
            assertTrue(next.merge());
            assertEquals("http://testserver/search", next.href());
        }

        @Test
        @DisplayName("Should return an empty page past the end")
        void shouldReturnEmptyPastEnd() {
            var page = catalog.getSearch(query(Map.of("pt", List.of(PageToken.encode(10)))), context);

            assertTrue(page.features().isEmpty());
            assertEquals(0, page.numberReturned());
        }

        @Test
        @DisplayName("Should page the items of one collection")
        void shouldPageItemCollection() {
            var page = catalog.itemCollection("landsat", query(Map.of("limit", List.of("1"))), context);

            assertEquals(List.of("l1"), ids(page));
            assertTrue(link(page.links(), Relations.NEXT).href()
                    .startsWith("http://testserver/collections/landsat/items?limit=1&pt="));
        }
    }

    @Nested
    @DisplayName("Transactions")
    class TransactionTests {

        @Test
        @DisplayName("Should reject a duplicate item")
        void shouldRejectDuplicateItem() {
            var e = assertThrows(
                    ResourceConflictException.class,
                    () -> catalog.createItem("landsat", item("l1", List.of(0, 0, 1, 1), "2020-01-01T00:00:00Z"),
                            context));

            assertTrue(e.getMessage().contains("landsat/l1"));
        }

        @Test
        @DisplayName("Should reject an item without an id")
        void shouldRequireItemId() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> catalog.createItem("landsat", new Item(Map.of("type", Item.TYPE)), context));
        }

        @Test
        @DisplayName("Should reject an item for a missing collection")
        void shouldRequireCollection() {
            assertThrows(
                    ResourceNotFoundException.class,
                    () -> catalog.createItem("modis", item("m1", List.of(0, 0, 1, 1), "2020-01-01T00:00:00Z"),
                            context));
        }

        @Test
        @DisplayName("Should update an item keeping its path identity")
        void shouldUpdateItem() {
            var updated = catalog.updateItem(
                    "landsat", "l1", item("other", List.of(1, 1, 2, 2), "2020-01-01T00:00:00Z"), context);

            assertEquals("l1", updated.id());
            assertEquals("landsat", updated.collection());
            assertEquals(List.of(1, 1, 2, 2), catalog.getItem("landsat", "l1", context).document().get("bbox"));
        }

        @Test
        @DisplayName("Should fail to update or delete a missing item")
        void shouldFailForMissingItem() {
            var replacement = item("l9", List.of(0, 0, 1, 1), "2020-01-01T00:00:00Z");

            assertThrows(
                    ResourceNotFoundException.class,
                    () -> catalog.updateItem("landsat", "l9", replacement, context));
            assertThrows(ResourceNotFoundException.class, () -> catalog.deleteItem("landsat", "l9", context));
        }

        @Test
        @DisplayName("Should delete an item")
        void shouldDeleteItem() {
            var removed = catalog.deleteItem("landsat", "l1", context);

            assertEquals("l1", removed.id());
            assertThrows(ResourceNotFoundException.class, () -> catalog.getItem("landsat", "l1", context));
        }

        @Test
        @DisplayName("Should reject a duplicate collection")
        void shouldRejectDuplicateCollection() {
            assertThrows(
                    ResourceConflictException.class, () -> catalog.createCollection(collection("landsat"), context));
        }

        @Test
        @DisplayName("Should update a collection")
        void shouldUpdateCollection() {
            var updated = catalog.updateCollection(
                    "landsat", new StacCollection(Map.of("type", "Collection", "title", "Landsat 8")), context);

            assertEquals("landsat", updated.id());
            assertEquals("Landsat 8", catalog.getCollection("landsat", context).title());
        }

        @Test
        @DisplayName("Should delete a collection with its items")
        void shouldDeleteCollection() {
            catalog.deleteCollection("landsat", context);

            assertThrows(ResourceNotFoundException.class, () -> catalog.getCollection("landsat", context));
            assertEquals(List.of("s1"), ids(catalog.getSearch(query(Map.of()), context)));
            assertEquals(1, catalog.allCollections(context).collections().size());
        }
    }
}
