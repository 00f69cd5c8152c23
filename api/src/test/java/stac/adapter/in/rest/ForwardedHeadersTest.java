package stac.adapter.in.rest;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@QuarkusTest
@DisplayName("Forwarded Headers Tests")
class ForwardedHeadersTest {

    private static final String SELF_HREF = "links.find { it.rel == 'self' }.href";
    private static final String DATA_HREF = "links.find { it.rel == 'data' }.href";

    @BeforeAll
    static void registerParsers() {
        StacRestAssured.registerParsers();
    }

    @Test
    @DisplayName("should build links from the Forwarded header")
    void shouldUseForwardedHeader() {
        given().header("Forwarded", "proto=https;host=test:1234")
                .when()
                .get("/")
                .then()
                .statusCode(200)
                .body(SELF_HREF, equalTo("https://test:1234/"))
                .body(DATA_HREF, equalTo("https://test:1234/collections"));
    }

    @Test
    @DisplayName("should build links from X-Forwarded headers and prefix")
    void shouldUseXForwardedHeaders() {
        given().header("X-Forwarded-Proto", "https")
                .header("X-Forwarded-Host", "stac.example.com")
                .header("X-Forwarded-Port", "443")
                .header("X-Forwarded-Prefix", "/catalog")
                .when()
                .get("/")
                .then()
                .statusCode(200)
                .body(SELF_HREF, equalTo("https://stac.example.com/catalog/"))
                .body(DATA_HREF, equalTo("https://stac.example.com/catalog/collections"));
    }

    @Test
    @DisplayName("should prefer Forwarded over X-Forwarded headers")
    void shouldPreferForwarded() {
        given().header("Forwarded", "for=192.0.2.60;proto=https;host=edge.example.com:8443")
                .header("X-Forwarded-Host", "ignored.example.com")
                .header("X-Forwarded-Proto", "http")
                .when()
                .get("/")
                .then()
                .statusCode(200)
                .body(SELF_HREF, equalTo("https://edge.example.com:8443/"));
    }
}
