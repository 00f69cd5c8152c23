package stac.spi;

import java.util.Map;

import io.smallrye.mutiny.Uni;

import stac.core.model.stac.Queryables;

/**
 * Non-blocking counterpart of {@link FiltersClient}.
 */
public interface AsyncFiltersClient {

    default Uni<Map<String, Object>> getQueryables(String collectionId, StacRequestContext context) {
        return Uni.createFrom().item(Queryables::emptySchema);
    }
}
