package stac.adapter.in.rest;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Liveness probe answered without touching the backend.
 */
@Path("/_mgmt")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class ManagementResource {

    @GET
    @Path("ping")
    public Map<String, String> ping() {
        return Map.of("message", "PONG");
    }
}
