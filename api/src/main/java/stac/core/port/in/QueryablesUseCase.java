package stac.core.port.in;

import java.util.Map;

import io.smallrye.mutiny.Uni;

import stac.spi.StacRequestContext;

/**
 * Port for the Filter extension's queryables routes.
 */
public interface QueryablesUseCase {

    /**
     * Get the queryables schema.
     *
     * @param collectionId the collection, or null for the catalog-wide schema
     * @param context      the request context
     * @return Uni with a JSON Schema document
     * @throws stac.core.model.common.FeatureDisabledException if the Filter extension is not enabled
     */
    Uni<Map<String, Object>> getQueryables(String collectionId, StacRequestContext context);
}
