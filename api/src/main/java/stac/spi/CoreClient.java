package stac.spi;

import stac.core.model.request.SearchRequest;
import stac.core.model.stac.CollectionList;
import stac.core.model.stac.Item;
import stac.core.model.stac.ItemCollection;
import stac.core.model.stac.StacCollection;

/**
 * Synchronous contract a storage backend implements to serve the core STAC API routes.
 *
 * <p>Calls are made on a worker thread and may block. Landing page and conformance documents
 * are assembled by the API layer from {@link #allCollections} and the enabled extensions.
 *
 * @see AsyncCoreClient
 */
public interface CoreClient {

    /**
     * Cross catalog search. Called with {@code GET /search}.
     *
     * @param request values bound with the composed {@code SearchGetRequest} model
     * @param context the request context
     * @return the matching items; paging through the opaque {@code pt} token is backend-defined
     */
    ItemCollection getSearch(SearchRequest request, StacRequestContext context);

    /**
     * Cross catalog search. Called with {@code POST /search}.
     *
     * @param request values bound with the composed {@code SearchPostRequest} model
     * @param context the request context
     * @return the matching items
     */
    ItemCollection postSearch(SearchRequest request, StacRequestContext context);

    /**
     * Called with {@code GET /collections/{collection_id}/items/{item_id}}.
     *
     * @throws stac.core.model.common.ResourceNotFoundException if the item does not exist
     */
    Item getItem(String collectionId, String itemId, StacRequestContext context);

    /**
     * Called with {@code GET /collections}.
     */
    CollectionList allCollections(StacRequestContext context);

    /**
     * Called with {@code GET /collections/{collection_id}}.
     *
     * @throws stac.core.model.common.ResourceNotFoundException if the collection does not exist
     */
    StacCollection getCollection(String collectionId, StacRequestContext context);

    /**
     * Items of one collection. Called with {@code GET /collections/{collection_id}/items}.
     *
     * @param collectionId the collection
     * @param request      values bound with the composed {@code ItemCollectionGetRequest} model
     * @param context      the request context
     * @return a page of items, same paging contract as search
     */
    ItemCollection itemCollection(String collectionId, SearchRequest request, StacRequestContext context);
}
