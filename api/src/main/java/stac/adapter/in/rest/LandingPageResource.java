package stac.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.UriInfo;

import io.smallrye.mutiny.Uni;

import stac.adapter.in.http.RequestContextFactory;
import stac.core.model.stac.Conformance;
import stac.core.model.stac.LandingPage;
import stac.core.port.in.StacCatalogUseCase;

/**
 * Landing page and conformance declaration.
 */
@Path("/")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class LandingPageResource {

    private final StacCatalogUseCase catalog;
    private final RequestContextFactory contexts;

    @Inject
    public LandingPageResource(StacCatalogUseCase catalog, RequestContextFactory contexts) {
        this.catalog = catalog;
        this.contexts = contexts;
    }

    @GET
    public Uni<LandingPage> landingPage(@Context UriInfo uriInfo, @Context HttpHeaders headers) {
        return catalog.landingPage(contexts.create(uriInfo, headers));
    }

    @GET
    @Path("conformance")
    public Conformance conformance() {
        return catalog.conformance();
    }
}
