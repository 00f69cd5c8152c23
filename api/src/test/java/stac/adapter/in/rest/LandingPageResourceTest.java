package stac.adapter.in.rest;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.startsWith;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import stac.core.model.extension.ConformanceClasses;
import stac.core.model.stac.Relations;

@QuarkusTest
@DisplayName("Landing Page Resource Tests")
class LandingPageResourceTest {

    @BeforeAll
    static void registerParsers() {
        StacRestAssured.registerParsers();
    }

    @Test
    @DisplayName("should describe the catalog")
    void shouldDescribeCatalog() {
        given().when()
                .get("/")
                .then()
                .statusCode(200)
                .body("type", equalTo("Catalog"))
                .body("id", equalTo("stac-api"))
                .body("stac_version", equalTo("1.0.0"))
                .body("conformsTo", hasItems(ConformanceClasses.STAC_CORE, ConformanceClasses.TRANSACTION));
    }

    @Test
    @DisplayName("should link the core routes")
    void shouldLinkCoreRoutes() {
        given().when()
                .get("/")
                .then()
                .statusCode(200)
                .body(
                        "links.rel",
                        hasItems(
                                Relations.SELF,
                                Relations.ROOT,
                                Relations.DATA,
                                Relations.CONFORMANCE,
                                Relations.SEARCH,
                                Relations.QUERYABLES,
                                Relations.SERVICE_DESC,
                                Relations.SERVICE_DOC))
                .body("links.find { it.rel == 'self' }.href", startsWith("http://localhost:"))
                .body("links.findAll { it.rel == 'search' }.method", hasItems("GET", "POST"))
                .body("links.find { it.rel == 'data' }.href", startsWith("http://localhost:"));
    }

    @Test
    @DisplayName("should list conformance classes")
    void shouldListConformance() {
        given().when()
                .get("/conformance")
                .then()
                .statusCode(200)
                .body("conformsTo", hasItems(ConformanceClasses.STAC_ITEM_SEARCH, ConformanceClasses.CQL2_JSON));
    }

    @Test
    @DisplayName("should answer the management ping")
    void shouldAnswerPing() {
        given().when().get("/_mgmt/ping").then().statusCode(200).body("message", equalTo("PONG"));
    }

    @Test
    @DisplayName("should report backend readiness")
    void shouldReportReadiness() {
        given().when()
                .get("/q/health/ready")
                .then()
                .statusCode(200)
                .body("checks.name", hasItem("stac-backend"))
                .body("checks.find { it.name == 'stac-backend' }.data.provider", equalTo("memory"));
    }

    @Test
    @DisplayName("should serve the OpenAPI description")
    void shouldServeOpenApi() {
        given().accept("application/json").when().get("/api").then().statusCode(200);
    }
}
