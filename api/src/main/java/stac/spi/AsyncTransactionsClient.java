package stac.spi;

import io.smallrye.mutiny.Uni;

import stac.core.model.stac.Item;
import stac.core.model.stac.ItemCollection;
import stac.core.model.stac.StacCollection;

/**
 * Non-blocking counterpart of {@link TransactionsClient}.
 */
public interface AsyncTransactionsClient {

    Uni<Item> createItem(String collectionId, Item item, StacRequestContext context);

    /**
     * Create every feature of a FeatureCollection; the default creates them one after another.
     */
    default Uni<Void> createItems(String collectionId, ItemCollection items, StacRequestContext context) {
        Uni<Void> chain = Uni.createFrom().voidItem();
        for (var item : items.features()) {
            chain = chain.chain(() -> createItem(collectionId, item, context).replaceWithVoid());
        }
        return chain;
    }

    Uni<Item> updateItem(String collectionId, String itemId, Item item, StacRequestContext context);

    Uni<Item> deleteItem(String collectionId, String itemId, StacRequestContext context);

    Uni<StacCollection> createCollection(StacCollection collection, StacRequestContext context);

    Uni<StacCollection> updateCollection(String collectionId, StacCollection collection, StacRequestContext context);

    Uni<StacCollection> deleteCollection(String collectionId, StacRequestContext context);
}
