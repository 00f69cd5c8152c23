package stac.adapter.out.storage.memory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.jboss.logging.Logger;

import stac.core.model.common.MediaTypes;
import stac.core.model.common.ResourceConflictException;
import stac.core.model.common.ResourceNotFoundException;
import stac.core.model.forwarding.HrefBuilder;
import stac.core.model.request.DatetimeInterval;
import stac.core.model.request.SearchParameterSets;
import stac.core.model.request.SearchRequest;
import stac.core.model.stac.CollectionList;
import stac.core.model.stac.Item;
import stac.core.model.stac.ItemCollection;
import stac.core.model.stac.Link;
import stac.core.model.stac.Relations;
import stac.core.model.stac.StacCollection;
import stac.spi.CoreClient;
import stac.spi.StacRequestContext;
import stac.spi.TransactionsClient;

/**
 * In-memory catalog implementing the blocking core and transactions clients.
 *
 * <p>Data is NOT persisted across restarts. Collections and items are kept in id order, which is
 * also the order of search results.
 *
 * <p>Search evaluates {@code collections}, {@code ids}, {@code bbox}, {@code datetime},
 * {@code limit} and the {@code pt} page token. Other parameters are accepted and ignored.
 *
 * <p>Thread-safety: Uses concurrent skip-list maps for safe concurrent access.
 */
public class InMemoryCatalog implements CoreClient, TransactionsClient {

    private static final Logger LOG = Logger.getLogger(InMemoryCatalog.class);

    private final ConcurrentNavigableMap<String, StacCollection> collections = new ConcurrentSkipListMap<>();
    private final ConcurrentNavigableMap<String, ConcurrentNavigableMap<String, Item>> items =
            new ConcurrentSkipListMap<>();

    @Override
    public ItemCollection getSearch(SearchRequest request, StacRequestContext context) {
        var matches = search(allItems(), request);
        return page(matches, request, context.hrefBuilder(), "search", PagingStyle.QUERY);
    }

    @Override
    public ItemCollection postSearch(SearchRequest request, StacRequestContext context) {
        var matches = search(allItems(), request);
        return page(matches, request, context.hrefBuilder(), "search", PagingStyle.BODY);
    }

    @Override
    public Item getItem(String collectionId, String itemId, StacRequestContext context) {
        requireCollection(collectionId);
        var item = items.getOrDefault(collectionId, new ConcurrentSkipListMap<>()).get(itemId);
        if (item == null) {
            throw ResourceNotFoundException.item(collectionId, itemId);
        }
        return withLinks(item, context.hrefBuilder());
    }

    @Override
    public CollectionList allCollections(StacRequestContext context) {
        var hrefs = context.hrefBuilder();
        var result = collections.values().stream()
                .map(collection -> withLinks(collection, hrefs))
                .toList();
        var links = List.of(
                Link.of(Relations.ROOT, MediaTypes.JSON, hrefs.build("")),
                Link.of(Relations.SELF, MediaTypes.JSON, hrefs.build("collections")));
        return new CollectionList(result, links);
    }

    @Override
    public StacCollection getCollection(String collectionId, StacRequestContext context) {
        return withLinks(requireCollection(collectionId), context.hrefBuilder());
    }

    @Override
    public ItemCollection itemCollection(String collectionId, SearchRequest request, StacRequestContext context) {
        requireCollection(collectionId);
        var stored = items.getOrDefault(collectionId, new ConcurrentSkipListMap<>()).values().stream();
        var matches = search(stored, request);
        return page(
                matches, request, context.hrefBuilder(), "collections/" + collectionId + "/items", PagingStyle.QUERY);
    }

    @Override
    public Item createItem(String collectionId, Item item, StacRequestContext context) {
        requireCollection(collectionId);
        var id = requireId(item.id(), "Item");
        var stored = item.with("collection", collectionId);
        var collectionItems = items.computeIfAbsent(collectionId, key -> new ConcurrentSkipListMap<>());
        if (collectionItems.putIfAbsent(id, stored) != null) {
            throw new ResourceConflictException("Item", collectionId + "/" + id);
        }
        LOG.debugv("Created item {0}/{1}", collectionId, id);
        return withLinks(stored, context.hrefBuilder());
    }

    @Override
    public Item updateItem(String collectionId, String itemId, Item item, StacRequestContext context) {
        requireCollection(collectionId);
        var stored = item.with("id", itemId).with("collection", collectionId);
        var collectionItems = items.getOrDefault(collectionId, new ConcurrentSkipListMap<>());
        if (collectionItems.replace(itemId, stored) == null) {
            throw ResourceNotFoundException.item(collectionId, itemId);
        }
        LOG.debugv("Updated item {0}/{1}", collectionId, itemId);
        return withLinks(stored, context.hrefBuilder());
    }

    @Override
    public Item deleteItem(String collectionId, String itemId, StacRequestContext context) {
        requireCollection(collectionId);
        var removed = items.getOrDefault(collectionId, new ConcurrentSkipListMap<>()).remove(itemId);
        if (removed == null) {
            throw ResourceNotFoundException.item(collectionId, itemId);
        }
        LOG.debugv("Deleted item {0}/{1}", collectionId, itemId);
        return removed;
    }

    @Override
    public StacCollection createCollection(StacCollection collection, StacRequestContext context) {
        var id = requireId(collection.id(), "Collection");
        if (collections.putIfAbsent(id, collection) != null) {
            throw new ResourceConflictException("Collection", id);
        }
        items.putIfAbsent(id, new ConcurrentSkipListMap<>());
        LOG.debugv("Created collection {0}", id);
        return withLinks(collection, context.hrefBuilder());
    }

    @Override
    public StacCollection updateCollection(
            String collectionId, StacCollection collection, StacRequestContext context) {
        var stored = collection.with("id", collectionId);
        if (collections.replace(collectionId, stored) == null) {
            throw ResourceNotFoundException.collection(collectionId);
        }
        LOG.debugv("Updated collection {0}", collectionId);
        return withLinks(stored, context.hrefBuilder());
    }

    @Override
    public StacCollection deleteCollection(String collectionId, StacRequestContext context) {
        var removed = collections.remove(collectionId);
        if (removed == null) {
            throw ResourceNotFoundException.collection(collectionId);
        }
        items.remove(collectionId);
        LOG.debugv("Deleted collection {0}", collectionId);
        return removed;
    }

    private StacCollection requireCollection(String collectionId) {
        var collection = collections.get(collectionId);
        if (collection == null) {
            throw ResourceNotFoundException.collection(collectionId);
        }
        return collection;
    }

    private static String requireId(String id, String resourceType) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(resourceType + " id is required");
        }
        return id;
    }

    private Stream<Item> allItems() {
        return items.values().stream().flatMap(collectionItems -> collectionItems.values().stream());
    }

    private static List<Item> search(Stream<Item> candidates, SearchRequest request) {
        var collectionIds = request.collections();
        var ids = request.ids();
        var bbox = request.bbox();
        var datetime = request.datetime();
        return candidates
                .filter(item -> collectionIds == null || collectionIds.contains(item.collection()))
                .filter(item -> ids == null || ids.contains(item.id()))
                .filter(item -> bbox == null || intersects(item, bbox))
                .filter(item -> datetime == null || overlaps(item, datetime))
                .toList();
    }

    private ItemCollection page(
            List<Item> matches, SearchRequest request, HrefBuilder hrefs, String path, PagingStyle style) {
        var limit = request.limit() != null ? request.limit() : SearchParameterSets.DEFAULT_LIMIT;
        var offset = PageToken.decode(request.pt());
        var end = (int) Math.min((long) offset + limit, matches.size());
        var pageItems = offset >= matches.size()
                ? List.<Item>of()
                : matches.subList(offset, end).stream().map(item -> withLinks(item, hrefs)).toList();

        var links = new ArrayList<Link>();
        links.add(Link.of(Relations.ROOT, MediaTypes.JSON, hrefs.build("")));
        links.add(Link.of(Relations.SELF, MediaTypes.GEOJSON, hrefs.build(path)));
        if (end < matches.size()) {
            var token = PageToken.encode(end);
            links.add(
                    switch (style) {
                        case QUERY -> Link.of(
                                Relations.NEXT, MediaTypes.GEOJSON, hrefs.build(path + nextQuery(request, token)));
                        case BODY -> new Link(
                                Relations.NEXT,
                                MediaTypes.GEOJSON,
                                hrefs.build(path),
                                null,
                                "POST",
                                Map.of("pt", token),
                                true);
                    });
        }
        return new ItemCollection(ItemCollection.TYPE, pageItems, links, matches.size(), pageItems.size());
    }

    private static String nextQuery(SearchRequest request, String token) {
        var params = new LinkedHashMap<String, String>();
        if (request.collections() != null) {
            params.put("collections", String.join(",", request.collections()));
        }
        if (request.ids() != null) {
            params.put("ids", String.join(",", request.ids()));
        }
        if (request.bbox() != null) {
            params.put("bbox", request.bbox().stream().map(String::valueOf).collect(Collectors.joining(",")));
        }
        if (request.datetime() != null) {
            params.put("datetime", request.datetime().text());
        }
        if (request.limit() != null) {
            params.put("limit", String.valueOf(request.limit()));
        }
        params.put("pt", token);
        return params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&", "?", ""));
    }

    private static boolean intersects(Item item, List<Double> bbox) {
        if (!(item.document().get("bbox") instanceof List<?> raw)
                || (raw.size() != 4 && raw.size() != 6)
                || !raw.stream().allMatch(Number.class::isInstance)) {
            return false;
        }
        var itemBox = raw.stream().map(v -> ((Number) v).doubleValue()).toList();
        return !(corner(itemBox, true, 0) < corner(bbox, false, 0)
                || corner(itemBox, false, 0) > corner(bbox, true, 0)
                || corner(itemBox, true, 1) < corner(bbox, false, 1)
                || corner(itemBox, false, 1) > corner(bbox, true, 1));
    }

    // Handles both 2D (minx, miny, maxx, maxy) and 3D (minx, miny, minz, maxx, maxy, maxz) boxes.
    private static double corner(List<Double> box, boolean max, int axis) {
        return box.get((max ? box.size() / 2 : 0) + axis);
    }

    private static boolean overlaps(Item item, DatetimeInterval interval) {
        var properties = item.properties();
        var instant = instant(properties.get("datetime"));
        if (instant != null) {
            return interval.contains(instant);
        }
        var start = instant(properties.get("start_datetime"));
        var end = instant(properties.get("end_datetime"));
        if (start == null || end == null) {
            return false;
        }
        return (interval.end() == null || !start.isAfter(interval.end()))
                && (interval.start() == null || !end.isBefore(interval.start()));
    }

    private static Instant instant(Object value) {
        if (!(value instanceof String text)) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            LOG.debugv("Ignoring unparseable item datetime {0}", text);
            return null;
        }
    }

    private static Item withLinks(Item item, HrefBuilder hrefs) {
        var collectionPath = "collections/" + item.collection();
        return item.with(
                "links",
                List.of(
                        Link.of(
                                Relations.SELF,
                                MediaTypes.GEOJSON,
                                hrefs.build(collectionPath + "/items/" + item.id())),
                        Link.of(Relations.PARENT, MediaTypes.JSON, hrefs.build(collectionPath)),
                        Link.of(Relations.COLLECTION, MediaTypes.JSON, hrefs.build(collectionPath)),
                        Link.of(Relations.ROOT, MediaTypes.JSON, hrefs.build(""))));
    }

    private static StacCollection withLinks(StacCollection collection, HrefBuilder hrefs) {
        var path = "collections/" + collection.id();
        return collection.with(
                "links",
                List.of(
                        Link.of(Relations.SELF, MediaTypes.JSON, hrefs.build(path)),
                        Link.of(Relations.PARENT, MediaTypes.JSON, hrefs.build("")),
                        Link.of(Relations.ITEMS, MediaTypes.GEOJSON, hrefs.build(path + "/items")),
                        Link.of(Relations.ROOT, MediaTypes.JSON, hrefs.build(""))));
    }

    private enum PagingStyle {
        QUERY,
        BODY
    }
}
