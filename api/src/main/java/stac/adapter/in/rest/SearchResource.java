package stac.adapter.in.rest;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.UriInfo;

import io.smallrye.mutiny.Uni;

import stac.adapter.in.http.RequestContextFactory;
import stac.core.model.common.MediaTypes;
import stac.core.model.stac.ItemCollection;
import stac.core.port.in.StacCatalogUseCase;

/**
 * Cross-collection item search.
 *
 * <p>GET parameters are bound with the composed {@code SearchGetRequest} model and POST bodies
 * with {@code SearchPostRequest}; both include the fields of every enabled extension.
 */
@Path("/search")
@ApplicationScoped
@Produces({MediaTypes.GEOJSON, MediaType.APPLICATION_JSON})
public class SearchResource {

    private final StacCatalogUseCase catalog;
    private final RequestContextFactory contexts;

    @Inject
    public SearchResource(StacCatalogUseCase catalog, RequestContextFactory contexts) {
        this.catalog = catalog;
        this.contexts = contexts;
    }

    @GET
    public Uni<ItemCollection> getSearch(@Context UriInfo uriInfo, @Context HttpHeaders headers) {
        return catalog.getSearch(uriInfo.getQueryParameters(), contexts.create(uriInfo, headers));
    }

    /**
     * Search with a JSON body; an empty body searches with defaults.
     */
    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<ItemCollection> postSearch(
            Map<String, Object> body, @Context UriInfo uriInfo, @Context HttpHeaders headers) {
        return catalog.postSearch(body, contexts.create(uriInfo, headers));
    }
}
