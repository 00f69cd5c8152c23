package stac.core.port.in;

import java.util.Map;

import io.smallrye.mutiny.Uni;

import stac.core.model.stac.Item;
import stac.core.model.stac.StacCollection;
import stac.spi.StacRequestContext;

/**
 * Port for the Transaction extension routes.
 *
 * <p>Every operation fails with {@link stac.core.model.common.FeatureDisabledException} unless the
 * Transaction extension is enabled and the backend supplies a transactions client.
 */
public interface TransactionManagement {

    boolean isEnabled();

    /**
     * Create an item, or every feature of a FeatureCollection.
     *
     * @param collectionId target collection
     * @param body         a GeoJSON Feature or FeatureCollection
     * @param context      the request context
     * @return Uni with the created item; null for a FeatureCollection or when the backend returns none
     * @throws IllegalArgumentException when the body is neither a Feature nor a FeatureCollection
     */
    Uni<Item> createItem(String collectionId, Map<String, Object> body, StacRequestContext context);

    Uni<Item> updateItem(String collectionId, String itemId, Item item, StacRequestContext context);

    Uni<Item> deleteItem(String collectionId, String itemId, StacRequestContext context);

    Uni<StacCollection> createCollection(StacCollection collection, StacRequestContext context);

    Uni<StacCollection> updateCollection(String collectionId, StacCollection collection, StacRequestContext context);

    Uni<StacCollection> deleteCollection(String collectionId, StacRequestContext context);
}
