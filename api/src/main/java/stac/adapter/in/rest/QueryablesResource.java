package stac.adapter.in.rest;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.UriInfo;

import io.smallrye.mutiny.Uni;

import stac.adapter.in.http.RequestContextFactory;
import stac.core.model.common.MediaTypes;
import stac.core.port.in.QueryablesUseCase;

/**
 * Catalog-wide queryables of the Filter extension. The per-collection variant lives on
 * {@link CollectionResource}.
 */
@Path("/queryables")
@ApplicationScoped
@Produces(MediaTypes.JSON_SCHEMA)
public class QueryablesResource {

    private final QueryablesUseCase queryables;
    private final RequestContextFactory contexts;

    @Inject
    public QueryablesResource(QueryablesUseCase queryables, RequestContextFactory contexts) {
        this.queryables = queryables;
        this.contexts = contexts;
    }

    @GET
    public Uni<Map<String, Object>> getQueryables(@Context UriInfo uriInfo, @Context HttpHeaders headers) {
        return queryables.getQueryables(null, contexts.create(uriInfo, headers));
    }
}
