package stac.core.service.common;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import stac.core.model.forwarding.ForwardedUrlParts;
import stac.core.model.forwarding.Header;
import stac.core.model.forwarding.RequestScope;

@DisplayName("ForwardedUrlResolver")
class ForwardedUrlResolverTest {

    private static ForwardedUrlParts resolve(String scheme, Header... headers) {
        return ForwardedUrlResolver.resolve(new RequestScope(scheme, "testserver", 80, List.of(headers)));
    }

    @Nested
    @DisplayName("Without proxy headers")
    class DirectRequestTests {

        @Test
        @DisplayName("Should use the server address when there is no Host header")
        void shouldUseServerAddressWithoutHostHeader() {
            assertEquals(new ForwardedUrlParts("https", "testserver", 80, null), resolve("https"));
        }

        @Test
        @DisplayName("Should take the port from the Host header")
        void shouldTakePortFromHostHeader() {
            assertEquals(
                    new ForwardedUrlParts("http", "testserver", 81, null),
                    resolve("http", new Header("host", "testserver:81")));
        }

        @Test
        @DisplayName("Should leave the port unset for a Host header without one")
        void shouldLeavePortUnsetForBareHost() {
            assertEquals(
                    new ForwardedUrlParts("http", "testserver", null, null),
                    resolve("http", new Header("host", "testserver")));
        }
    }

    @Nested
    @DisplayName("Forwarded header")
    class ForwardedTests {

        @Test
        @DisplayName("Should take proto, host and port from Forwarded")
        void shouldTakeProtoHostAndPort() {
            assertEquals(
                    new ForwardedUrlParts("https", "test", 1234, null),
                    resolve("http", new Header("forwarded", "proto=https;host=test:1234")));
        }

        @Test
        @DisplayName("Should accept a quoted host with a port")
        void shouldAcceptQuotedHost() {
            var parts = resolve(
                    "http",
                    new Header("forwarded", "proto=https;host=\"test:1234\""),
                    new Header("x-forwarded-host", "another-test"));

            assertEquals(new ForwardedUrlParts("https", "test", 1234, null), parts);
        }

        @Test
        @DisplayName("Should read directives and proto regardless of case")
        void shouldIgnoreCase() {
            assertEquals(
                    new ForwardedUrlParts("https", "test", 1234, null),
                    resolve("http", new Header("forwarded", "Proto=HTTPS;Host=test:1234")));
        }

        @Test
        @DisplayName("Should fall back to the server port for a non-numeric forwarded port")
        void shouldFallBackToServerPort() {
            assertEquals(
                    new ForwardedUrlParts("https", "test", 80, null),
                    resolve("http", new Header("forwarded", "proto=https;host=test:not-an-integer")));
        }

        @Test
        @DisplayName("Should win over every X-Forwarded header")
        void shouldWinOverXForwarded() {
            var parts = resolve(
                    "http",
                    new Header("forwarded", "proto=https;host=test:1234"),
                    new Header("x-forwarded-host", "another-test"),
                    new Header("x-forwarded-port", "1111"),
                    new Header("x-forwarded-proto", "https"));

            assertEquals(new ForwardedUrlParts("https", "test", 1234, null), parts);
        }

        @Test
        @DisplayName("Should use the last complete entry of a forwarded chain")
        void shouldUseLastCompleteEntry() {
            var parts = resolve(
                    "http", new Header("Forwarded", "proto=http;host=first, proto=https;host=second.example.com:8443"));

            assertEquals(new ForwardedUrlParts("https", "second.example.com", 8443, null), parts);
        }

        @Test
        @DisplayName("Should ignore entries missing proto or host")
        void shouldIgnoreIncompleteEntries() {
            var parts = resolve("http", new Header("host", "testserver:81"), new Header("forwarded", "for=10.0.0.1"));

            assertEquals(new ForwardedUrlParts("http", "testserver", 81, null), parts);
        }
    }

    @Nested
    @DisplayName("X-Forwarded headers")
    class XForwardedTests {

        @Test
        @DisplayName("Should override the host")
        void shouldOverrideHost() {
            assertEquals(
                    new ForwardedUrlParts("http", "test", 80, null),
                    resolve("http", new Header("x-forwarded-host", "test")));
        }

        @Test
        @DisplayName("Should override the scheme")
        void shouldOverrideScheme() {
            assertEquals(
                    new ForwardedUrlParts("https", "testserver", 80, null),
                    resolve("http", new Header("x-forwarded-proto", "https")));
        }

        @Test
        @DisplayName("Should override the port")
        void shouldOverridePort() {
            assertEquals(
                    new ForwardedUrlParts("http", "testserver", 1111, null),
                    resolve("http", new Header("x-forwarded-port", "1111")));
        }

        @Test
        @DisplayName("Should keep the port when X-Forwarded-Port is not numeric")
        void shouldKeepPortForNonNumericValue() {
            assertEquals(
                    new ForwardedUrlParts("http", "testserver", 80, null),
                    resolve("http", new Header("x-forwarded-port", "not-an-integer")));
        }

        @Test
        @DisplayName("Should return the prefix verbatim")
        void shouldReturnPrefix() {
            assertEquals(
                    new ForwardedUrlParts("http", "testserver", 80, "/rest"),
                    resolve("http", new Header("x-forwarded-prefix", "/rest")));
        }
    }

    @Nested
    @DisplayName("Host splitting")
    class SplitHostPortTests {

        @Test
        @DisplayName("Should split on the last colon")
        void shouldSplitOnLastColon() {
            assertArrayEquals(
                    new String[] {"example.com", "8080"}, ForwardedUrlResolver.splitHostPort("example.com:8080"));
        }

        @Test
        @DisplayName("Should keep bracketed IPv6 literals intact")
        void shouldKeepIpv6Intact() {
            assertArrayEquals(new String[] {"[::1]", null}, ForwardedUrlResolver.splitHostPort("[::1]"));
            assertArrayEquals(new String[] {"[::1]", "9000"}, ForwardedUrlResolver.splitHostPort("[::1]:9000"));
        }
    }
}
