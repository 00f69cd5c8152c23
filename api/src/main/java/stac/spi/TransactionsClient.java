package stac.spi;

import stac.core.model.stac.Item;
import stac.core.model.stac.ItemCollection;
import stac.core.model.stac.StacCollection;

/**
 * Synchronous contract for the Transaction extension.
 *
 * <p>Updates are complete replacements of the stored resource; partial updates are not part of
 * the extension. Implementations signal missing resources with
 * {@link stac.core.model.common.ResourceNotFoundException} and duplicates with
 * {@link stac.core.model.common.ResourceConflictException}.
 */
public interface TransactionsClient {

    /**
     * Called with {@code POST /collections/{collection_id}/items} and a Feature body.
     *
     * @return the created item, or null when the backend has nothing to return
     */
    Item createItem(String collectionId, Item item, StacRequestContext context);

    /**
     * Called with {@code POST /collections/{collection_id}/items} and a FeatureCollection body.
     *
     * <p>The default implementation creates each feature in order.
     */
    default void createItems(String collectionId, ItemCollection items, StacRequestContext context) {
        for (var item : items.features()) {
            createItem(collectionId, item, context);
        }
    }

    /**
     * Called with {@code PUT /collections/{collection_id}/items/{item_id}}. The item must be complete.
     *
     * @return the updated item, or null
     */
    Item updateItem(String collectionId, String itemId, Item item, StacRequestContext context);

    /**
     * Called with {@code DELETE /collections/{collection_id}/items/{item_id}}.
     *
     * @return the deleted item, or null
     */
    Item deleteItem(String collectionId, String itemId, StacRequestContext context);

    /**
     * Called with {@code POST /collections}.
     *
     * @return the created collection, or null
     */
    StacCollection createCollection(StacCollection collection, StacRequestContext context);

    /**
     * Called with {@code PUT /collections/{collection_id}}. The collection must be complete.
     *
     * @return the updated collection, or null
     */
    StacCollection updateCollection(String collectionId, StacCollection collection, StacRequestContext context);

    /**
     * Called with {@code DELETE /collections/{collection_id}}.
     *
     * @return the deleted collection, or null
     */
    StacCollection deleteCollection(String collectionId, StacRequestContext context);
}
