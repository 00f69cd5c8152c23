package stac.spi;

import java.util.Map;

import stac.core.model.stac.Queryables;

/**
 * Synchronous contract for the Filter extension's queryables routes.
 */
public interface FiltersClient {

    /**
     * Get the queryables available for a collection.
     *
     * <p>The default returns a schema with no properties.
     *
     * @param collectionId the collection, or null for the intersection over all collections
     * @param context      the request context
     * @return a JSON Schema document
     */
    default Map<String, Object> getQueryables(String collectionId, StacRequestContext context) {
        return Queryables.emptySchema();
    }
}
