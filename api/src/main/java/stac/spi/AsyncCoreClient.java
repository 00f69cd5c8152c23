package stac.spi;

import io.smallrye.mutiny.Uni;

import stac.core.model.request.SearchRequest;
import stac.core.model.stac.CollectionList;
import stac.core.model.stac.Item;
import stac.core.model.stac.ItemCollection;
import stac.core.model.stac.StacCollection;

/**
 * Non-blocking counterpart of {@link CoreClient}, operation for operation.
 *
 * <p>Implementations must not block the calling thread. Missing resources fail the returned
 * {@code Uni} with {@link stac.core.model.common.ResourceNotFoundException}.
 */
public interface AsyncCoreClient {

    Uni<ItemCollection> getSearch(SearchRequest request, StacRequestContext context);

    Uni<ItemCollection> postSearch(SearchRequest request, StacRequestContext context);

    Uni<Item> getItem(String collectionId, String itemId, StacRequestContext context);

    Uni<CollectionList> allCollections(StacRequestContext context);

    Uni<StacCollection> getCollection(String collectionId, StacRequestContext context);

    Uni<ItemCollection> itemCollection(String collectionId, SearchRequest request, StacRequestContext context);
}
