package stac.spi;

import java.util.List;

import stac.core.model.forwarding.Header;
import stac.core.model.forwarding.HrefBuilder;
import stac.core.service.common.HeaderList;

/**
 * Per-request information handed to backend clients.
 *
 * @param hrefBuilder builds absolute links as seen by the client, honouring proxy headers
 * @param headers     raw request headers
 */
public record StacRequestContext(HrefBuilder hrefBuilder, List<Header> headers) {

    public StacRequestContext {
        if (hrefBuilder == null) {
            throw new IllegalArgumentException("hrefBuilder is required");
        }
        headers = headers == null ? List.of() : List.copyOf(headers);
    }

    public static StacRequestContext of(String baseUrl) {
        return new StacRequestContext(HrefBuilder.of(baseUrl), List.of());
    }

    public String header(String name) {
        return HeaderList.getValue(headers, name);
    }
}
