package stac.core.model.extension;

import java.util.List;
import java.util.Optional;

import stac.core.model.request.ParameterSet;
import stac.core.model.request.RequestMethod;

/**
 * An optional fragment of the STAC API specification.
 *
 * <p>An extension advertises conformance classes and may contribute request fields to the
 * search and item-collection routes, separately per HTTP method. Extensions are created once at
 * startup and held in order; that order is the field merge order.
 */
public interface ApiExtension {

    ExtensionType type();

    /**
     * Conformance class URIs this extension adds to the server's conformance declaration.
     */
    List<String> conformanceClasses();

    /**
     * Fields contributed to requests of the given method.
     *
     * @param method the HTTP method of the route being composed
     * @return the contributed set, or empty when the extension adds nothing for that method
     */
    default Optional<ParameterSet> requestModel(RequestMethod method) {
        return Optional.empty();
    }

    /**
     * JSON schema of the extension, advertised in {@code stac_extensions} on the landing page.
     */
    default Optional<String> schemaHref() {
        return Optional.empty();
    }
}
