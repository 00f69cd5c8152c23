package stac.adapter.in.http;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.vertx.web.RouteFilter;
import io.vertx.ext.web.RoutingContext;
import org.jboss.logging.Logger;

import stac.config.CorsConfigMapping;
import stac.core.model.common.CorsPolicy;

/**
 * CORS filter using Vert.x RouteFilter.
 *
 * <p>Answers preflight (OPTIONS) requests and adds CORS headers to every other response. Runs at
 * the Vert.x routing level, before JAX-RS.
 */
@ApplicationScoped
public class CorsFilter {

    private static final Logger LOG = Logger.getLogger(CorsFilter.class);

    private static final String ORIGIN_HEADER = "Origin";
    private static final String ACCESS_CONTROL_ALLOW_ORIGIN = "Access-Control-Allow-Origin";
    private static final String ACCESS_CONTROL_ALLOW_METHODS = "Access-Control-Allow-Methods";
    private static final String ACCESS_CONTROL_ALLOW_HEADERS = "Access-Control-Allow-Headers";
    private static final String ACCESS_CONTROL_EXPOSE_HEADERS = "Access-Control-Expose-Headers";
    private static final String ACCESS_CONTROL_ALLOW_CREDENTIALS = "Access-Control-Allow-Credentials";
    private static final String ACCESS_CONTROL_MAX_AGE = "Access-Control-Max-Age";
    private static final String ACCESS_CONTROL_REQUEST_METHOD = "Access-Control-Request-Method";
    private static final String VARY = "Vary";

    private final boolean enabled;
    private final CorsPolicy policy;

    @Inject
    public CorsFilter(CorsConfigMapping config) {
        this.enabled = config.enabled();
        this.policy = new CorsPolicy(
                config.allowedOrigins(),
                config.allowedMethods(),
                config.allowedHeaders(),
                config.exposedHeaders().orElse(null),
                config.allowCredentials(),
                config.maxAge());
    }

    @RouteFilter(100)
    void corsHandler(RoutingContext rc) {
        if (!enabled) {
            rc.next();
            return;
        }

        String origin = rc.request().getHeader(ORIGIN_HEADER);
        if (origin == null || origin.isBlank()) {
            rc.next();
            return;
        }

        if ("OPTIONS".equalsIgnoreCase(rc.request().method().name())
                && rc.request().getHeader(ACCESS_CONTROL_REQUEST_METHOD) != null) {
            handlePreflight(rc, origin);
            return;
        }

        addCorsHeaders(rc, origin);
        rc.next();
    }

    private void handlePreflight(RoutingContext rc, String origin) {
        String requestMethod = rc.request().getHeader(ACCESS_CONTROL_REQUEST_METHOD);

        if (!policy.isOriginAllowed(origin) || !policy.isMethodAllowed(requestMethod)) {
            LOG.debugf("CORS preflight rejected: %s from origin %s", requestMethod, origin);
            rc.response().setStatusCode(403).end("Forbidden");
            return;
        }

        setAllowOrigin(rc, origin);
        rc.response().putHeader(ACCESS_CONTROL_ALLOW_METHODS, policy.allowedMethodsHeader());
        rc.response().putHeader(ACCESS_CONTROL_ALLOW_HEADERS, policy.allowedHeadersHeader());
        policy.maxAge().ifPresent(maxAge -> rc.response().putHeader(ACCESS_CONTROL_MAX_AGE, maxAge.toString()));
        rc.response().setStatusCode(200).end();
    }

    private void addCorsHeaders(RoutingContext rc, String origin) {
        if (!policy.isOriginAllowed(origin)) {
            return;
        }
        setAllowOrigin(rc, origin);
        if (!policy.exposedHeaders().isEmpty()) {
            rc.response().putHeader(ACCESS_CONTROL_EXPOSE_HEADERS, String.join(", ", policy.exposedHeaders()));
        }
    }

    private void setAllowOrigin(RoutingContext rc, String origin) {
        var value = policy.allowOriginValue(origin);
        rc.response().putHeader(ACCESS_CONTROL_ALLOW_ORIGIN, value);
        if (!"*".equals(value)) {
            rc.response().putHeader(VARY, ORIGIN_HEADER);
        }
        if (policy.allowCredentials()) {
            rc.response().putHeader(ACCESS_CONTROL_ALLOW_CREDENTIALS, "true");
        }
    }
}
