package stac.adapter.in.http;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.UriInfo;

import org.jboss.logging.Logger;

import stac.core.config.StacApiConfig;
import stac.core.model.forwarding.Header;
import stac.core.model.forwarding.HrefBuilder;
import stac.core.model.forwarding.RequestScope;
import stac.core.service.common.ForwardedUrlResolver;
import stac.spi.StacRequestContext;

/**
 * Builds the per-request {@link StacRequestContext} for JAX-RS resources.
 *
 * <p>When proxy headers are trusted, the base URL is reconstructed from {@code Forwarded},
 * {@code X-Forwarded-*} and {@code Host}; otherwise the raw request base URI is used.
 */
@ApplicationScoped
public class RequestContextFactory {

    private static final Logger LOG = Logger.getLogger(RequestContextFactory.class);

    private final boolean trustProxyHeaders;

    @Inject
    public RequestContextFactory(StacApiConfig config) {
        this.trustProxyHeaders = config.forwarding().trustProxyHeaders();
    }

    public StacRequestContext create(UriInfo uriInfo, HttpHeaders httpHeaders) {
        var headers = toHeaderList(httpHeaders);
        return new StacRequestContext(hrefBuilder(uriInfo, headers), headers);
    }

    HrefBuilder hrefBuilder(UriInfo uriInfo, List<Header> headers) {
        var baseUri = uriInfo.getBaseUri();
        if (!trustProxyHeaders) {
            return HrefBuilder.of(baseUri.toString());
        }
        var requestUri = uriInfo.getRequestUri();
        var scope = new RequestScope(
                requestUri.getScheme(),
                requestUri.getHost(),
                serverPort(requestUri),
                headers);
        var parts = ForwardedUrlResolver.resolve(scope);
        LOG.debugv("Resolved request base {0} from {1}", parts, requestUri);
        return HrefBuilder.of(parts, baseUri.getPath());
    }

    // The listening port, implied by the scheme when the request URI leaves it out.
    static int serverPort(URI requestUri) {
        if (requestUri.getPort() > 0) {
            return requestUri.getPort();
        }
        return "https".equalsIgnoreCase(requestUri.getScheme()) ? 443 : 80;
    }

    static List<Header> toHeaderList(HttpHeaders httpHeaders) {
        var headers = new ArrayList<Header>();
        if (httpHeaders == null) {
            return headers;
        }
        httpHeaders.getRequestHeaders().forEach((name, values) -> {
            for (var value : values) {
                headers.add(new Header(name, value));
            }
        });
        return headers;
    }
}
