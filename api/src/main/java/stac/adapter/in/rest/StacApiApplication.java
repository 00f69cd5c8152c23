package stac.adapter.in.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;

import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;

/**
 * Jakarta RS application with OpenAPI metadata.
 *
 * <p>The generated document is served at {@code /api} (the landing page's service-desc link) and
 * its rendered form at {@code /api.html} (service-doc).
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "STAC API",
                version = "1.0.0",
                description = "SpatioTemporal Asset Catalog API with item search, collections and the "
                        + "filter, CRS, transaction and pagination extensions.",
                license = @License(name = "MIT", url = "https://opensource.org/licenses/MIT")))
public class StacApiApplication extends Application {}
