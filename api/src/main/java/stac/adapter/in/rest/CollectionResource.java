package stac.adapter.in.rest;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;

import io.smallrye.mutiny.Uni;

import stac.adapter.in.http.RequestContextFactory;
import stac.adapter.in.problem.StacProblem;
import stac.core.model.common.MediaTypes;
import stac.core.model.stac.CollectionList;
import stac.core.model.stac.Item;
import stac.core.model.stac.ItemCollection;
import stac.core.model.stac.StacCollection;
import stac.core.port.in.QueryablesUseCase;
import stac.core.port.in.StacCatalogUseCase;
import stac.core.port.in.TransactionManagement;

/**
 * Collections and their items.
 *
 * <p>Write operations belong to the Transaction extension and answer 404 "Feature Disabled"
 * unless it is enabled and the backend supports it.
 */
@Path("/collections")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class CollectionResource {

    private final StacCatalogUseCase catalog;
    private final TransactionManagement transactions;
    private final QueryablesUseCase queryables;
    private final RequestContextFactory contexts;

    @Inject
    public CollectionResource(
            StacCatalogUseCase catalog,
            TransactionManagement transactions,
            QueryablesUseCase queryables,
            RequestContextFactory contexts) {
        this.catalog = catalog;
        this.transactions = transactions;
        this.queryables = queryables;
        this.contexts = contexts;
    }

    @GET
    public Uni<CollectionList> allCollections(@Context UriInfo uriInfo, @Context HttpHeaders headers) {
        return catalog.allCollections(contexts.create(uriInfo, headers));
    }

    /**
     * Create a collection.
     *
     * @return 201 Created with the stored collection
     */
    @POST
    public Uni<Response> createCollection(
            StacCollection collection, @Context UriInfo uriInfo, @Context HttpHeaders headers) {
        requireBody(collection);
        return transactions
                .createCollection(collection, contexts.create(uriInfo, headers))
                .map(created -> withEntity(Response.Status.CREATED, created, MediaType.APPLICATION_JSON));
    }

    @GET
    @Path("/{collection_id}")
    public Uni<StacCollection> getCollection(
            @PathParam("collection_id") String collectionId, @Context UriInfo uriInfo, @Context HttpHeaders headers) {
        return catalog.getCollection(collectionId, contexts.create(uriInfo, headers));
    }

    /**
     * Replace a collection. The body must be the complete collection.
     */
    @PUT
    @Path("/{collection_id}")
    public Uni<Response> updateCollection(
            @PathParam("collection_id") String collectionId,
            StacCollection collection,
            @Context UriInfo uriInfo,
            @Context HttpHeaders headers) {
        requireBody(collection);
        return transactions
                .updateCollection(collectionId, collection, contexts.create(uriInfo, headers))
                .map(updated -> withEntity(Response.Status.OK, updated, MediaType.APPLICATION_JSON));
    }

    @DELETE
    @Path("/{collection_id}")
    public Uni<Response> deleteCollection(
            @PathParam("collection_id") String collectionId, @Context UriInfo uriInfo, @Context HttpHeaders headers) {
        return transactions
                .deleteCollection(collectionId, contexts.create(uriInfo, headers))
                .map(deleted -> withEntity(Response.Status.OK, deleted, MediaType.APPLICATION_JSON));
    }

    /**
     * Items of one collection, bound with the composed {@code ItemCollectionGetRequest} model.
     */
    @GET
    @Path("/{collection_id}/items")
    @Produces({MediaTypes.GEOJSON, MediaType.APPLICATION_JSON})
    public Uni<ItemCollection> itemCollection(
            @PathParam("collection_id") String collectionId, @Context UriInfo uriInfo, @Context HttpHeaders headers) {
        return catalog.itemCollection(collectionId, uriInfo.getQueryParameters(), contexts.create(uriInfo, headers));
    }

    /**
     * Create an item from a Feature, or every item of a FeatureCollection.
     *
     * @return 201 Created, with the item for a Feature body and without a body otherwise
     */
    @POST
    @Path("/{collection_id}/items")
    public Uni<Response> createItem(
            @PathParam("collection_id") String collectionId,
            Map<String, Object> body,
            @Context UriInfo uriInfo,
            @Context HttpHeaders headers) {
        requireBody(body);
        return transactions
                .createItem(collectionId, body, contexts.create(uriInfo, headers))
                .map(created -> withEntity(Response.Status.CREATED, created, MediaTypes.GEOJSON));
    }

    @GET
    @Path("/{collection_id}/items/{item_id}")
    @Produces({MediaTypes.GEOJSON, MediaType.APPLICATION_JSON})
    public Uni<Item> getItem(
            @PathParam("collection_id") String collectionId,
            @PathParam("item_id") String itemId,
            @Context UriInfo uriInfo,
            @Context HttpHeaders headers) {
        return catalog.getItem(collectionId, itemId, contexts.create(uriInfo, headers));
    }

    /**
     * Replace an item. The body must be the complete item.
     */
    @PUT
    @Path("/{collection_id}/items/{item_id}")
    public Uni<Response> updateItem(
            @PathParam("collection_id") String collectionId,
            @PathParam("item_id") String itemId,
            Item item,
            @Context UriInfo uriInfo,
            @Context HttpHeaders headers) {
        requireBody(item);
        return transactions
                .updateItem(collectionId, itemId, item, contexts.create(uriInfo, headers))
                .map(updated -> withEntity(Response.Status.OK, updated, MediaTypes.GEOJSON));
    }

    @DELETE
    @Path("/{collection_id}/items/{item_id}")
    public Uni<Response> deleteItem(
            @PathParam("collection_id") String collectionId,
            @PathParam("item_id") String itemId,
            @Context UriInfo uriInfo,
            @Context HttpHeaders headers) {
        return transactions
                .deleteItem(collectionId, itemId, contexts.create(uriInfo, headers))
                .map(deleted -> withEntity(Response.Status.OK, deleted, MediaTypes.GEOJSON));
    }

    @GET
    @Path("/{collection_id}/queryables")
    @Produces(MediaTypes.JSON_SCHEMA)
    public Uni<Map<String, Object>> getQueryables(
            @PathParam("collection_id") String collectionId, @Context UriInfo uriInfo, @Context HttpHeaders headers) {
        return queryables.getQueryables(collectionId, contexts.create(uriInfo, headers));
    }

    private static void requireBody(Object body) {
        if (body == null) {
            throw StacProblem.badRequest("Request body is required");
        }
    }

    // A null result from the backend answers without a body.
    private static Response withEntity(Response.Status status, Object entity, String mediaType) {
        if (entity == null) {
            return status == Response.Status.OK
                    ? Response.noContent().build()
                    : Response.status(status).build();
        }
        return Response.status(status).entity(entity).type(mediaType).build();
    }
}
