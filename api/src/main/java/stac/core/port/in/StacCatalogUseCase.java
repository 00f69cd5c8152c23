package stac.core.port.in;

import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Uni;

import stac.core.model.stac.CollectionList;
import stac.core.model.stac.Conformance;
import stac.core.model.stac.Item;
import stac.core.model.stac.ItemCollection;
import stac.core.model.stac.LandingPage;
import stac.core.model.stac.StacCollection;
import stac.spi.StacRequestContext;

/**
 * Port for the read-only STAC API routes.
 */
public interface StacCatalogUseCase {

    /**
     * Assemble the landing page.
     *
     * <p>Links appear in a fixed order: self, root, data, conformance, search (GET), search (POST),
     * queryables when the Filter extension is enabled, one child link per collection in backend
     * order, service-desc, service-doc.
     *
     * @param context the request context
     * @return Uni with the landing page
     */
    Uni<LandingPage> landingPage(StacRequestContext context);

    /**
     * Base conformance classes plus those of every enabled extension, without duplicates.
     */
    Conformance conformance();

    /**
     * Search with query-string parameters.
     *
     * @param queryParameters decoded parameters, repeated names keep every value
     * @param context         the request context
     * @return Uni with the matching items
     * @throws IllegalArgumentException when a parameter fails binding or validation
     */
    Uni<ItemCollection> getSearch(Map<String, List<String>> queryParameters, StacRequestContext context);

    /**
     * Search with a JSON object body.
     *
     * @param body    the parsed body, null is treated as an empty object
     * @param context the request context
     * @return Uni with the matching items
     */
    Uni<ItemCollection> postSearch(Map<String, Object> body, StacRequestContext context);

    Uni<CollectionList> allCollections(StacRequestContext context);

    Uni<StacCollection> getCollection(String collectionId, StacRequestContext context);

    Uni<ItemCollection> itemCollection(
            String collectionId, Map<String, List<String>> queryParameters, StacRequestContext context);

    Uni<Item> getItem(String collectionId, String itemId, StacRequestContext context);
}
