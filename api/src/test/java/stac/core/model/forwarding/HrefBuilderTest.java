package stac.core.model.forwarding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("HrefBuilder")
class HrefBuilderTest {

    @Nested
    @DisplayName("build")
    class BuildTests {

        private final HrefBuilder builder = HrefBuilder.of("https://example.com/stac");

        @Test
        @DisplayName("Should add a trailing slash to the base URL")
        void shouldNormalizeBaseUrl() {
            assertEquals("https://example.com/stac/", builder.baseUrl());
            assertEquals("https://example.com/stac/", builder.build(""));
            assertEquals("https://example.com/stac/", builder.build(null));
        }

        @ParameterizedTest
        @ValueSource(strings = {"collections/foo", "/collections/foo", "./collections/foo", "//collections/foo"})
        @DisplayName("Should resolve paths below the base URL")
        void shouldStayBelowBase(String path) {
            assertEquals("https://example.com/stac/collections/foo", builder.build(path));
        }

        @Test
        @DisplayName("Should treat a dot as the base URL")
        void shouldResolveDot() {
            assertEquals("https://example.com/stac/", builder.build("."));
        }
    }

    @Nested
    @DisplayName("of")
    class FactoryTests {

        @ParameterizedTest
        @ValueSource(strings = {"example.com/stac", "/relative", "http:///nohost"})
        @DisplayName("Should reject a base URL without scheme or host")
        void shouldRejectRelativeBase(String baseUrl) {
            assertThrows(IllegalArgumentException.class, () -> HrefBuilder.of(baseUrl));
        }

        @Test
        @DisplayName("Should reject a null base URL")
        void shouldRejectNull() {
            assertThrows(IllegalArgumentException.class, () -> HrefBuilder.of((String) null));
        }

        @Test
        @DisplayName("Should build from forwarded parts and a root path")
        void shouldBuildFromParts() {
            var parts = new ForwardedUrlParts("https", "test", 1234, "/proxy/");

            assertEquals("https://test:1234/proxy/stac/", HrefBuilder.of(parts, "/stac").baseUrl());
        }

        @Test
        @DisplayName("Should omit default ports")
        void shouldOmitDefaultPorts() {
            assertEquals("https://test/", HrefBuilder.of(new ForwardedUrlParts("https", "test", 443, null), "/")
                    .baseUrl());
            assertEquals("http://test/", HrefBuilder.of(new ForwardedUrlParts("http", "test", 80, null), null)
                    .baseUrl());
            assertEquals("http://test:8080/", HrefBuilder.of(new ForwardedUrlParts("http", "test", 8080, ""), "/")
                    .baseUrl());
        }
    }
}
