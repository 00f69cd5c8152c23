package stac.core.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import stac.core.config.StacApiConfig;
import stac.core.model.common.MediaTypes;
import stac.core.model.extension.ExtensionType;
import stac.core.model.forwarding.HrefBuilder;
import stac.core.model.request.RequestModel;
import stac.core.model.request.SearchRequest;
import stac.core.model.stac.CollectionList;
import stac.core.model.stac.Conformance;
import stac.core.model.stac.Item;
import stac.core.model.stac.ItemCollection;
import stac.core.model.stac.LandingPage;
import stac.core.model.stac.Link;
import stac.core.model.stac.Relations;
import stac.core.model.stac.StacCollection;
import stac.core.port.in.StacCatalogUseCase;
import stac.core.port.out.BackendMetrics;
import stac.core.service.common.BackendCalls;
import stac.spi.StacBackend;
import stac.spi.StacRequestContext;

/**
 * Serves the read-only routes by binding request input against the composed request models and
 * delegating to the backend's core client.
 */
@ApplicationScoped
public class CatalogService implements StacCatalogUseCase {

    private final StacBackend backend;
    private final ExtensionRegistry registry;
    private final SearchRequestModels requestModels;
    private final StacApiConfig config;
    private final BackendMetrics metrics;

    @Inject
    public CatalogService(
            StacBackend backend,
            ExtensionRegistry registry,
            SearchRequestModels requestModels,
            StacApiConfig config,
            BackendMetrics metrics) {
        this.backend = backend;
        this.registry = registry;
        this.requestModels = requestModels;
        this.config = config;
        this.metrics = metrics;
    }

    @Override
    public Uni<LandingPage> landingPage(StacRequestContext context) {
        return BackendCalls.observe(metrics, "allCollections", () -> backend.core().allCollections(context))
                .map(collections -> new LandingPage(
                        LandingPage.CATALOG,
                        config.landingId(),
                        config.title(),
                        config.description(),
                        config.stacVersion(),
                        registry.conformanceClasses(),
                        landingLinks(context.hrefBuilder(), collections),
                        registry.schemaHrefs()));
    }

    List<Link> landingLinks(HrefBuilder hrefs, CollectionList collections) {
        var links = new ArrayList<Link>();
        links.add(Link.of(Relations.SELF, MediaTypes.JSON, hrefs.build("")));
        links.add(Link.of(Relations.ROOT, MediaTypes.JSON, hrefs.build("")));
        links.add(Link.of(Relations.DATA, MediaTypes.JSON, hrefs.build("collections")));
        links.add(Link.of(
                Relations.CONFORMANCE,
                MediaTypes.JSON,
                hrefs.build("conformance"),
                "STAC/WFS3 conformance classes implemented by this server"));
        links.add(new Link(Relations.SEARCH, MediaTypes.GEOJSON, hrefs.build("search"), "STAC search", "GET"));
        links.add(new Link(Relations.SEARCH, MediaTypes.GEOJSON, hrefs.build("search"), "STAC search", "POST"));
        if (registry.isEnabled(ExtensionType.FILTER)) {
            links.add(new Link(
                    Relations.QUERYABLES, MediaTypes.JSON_SCHEMA, hrefs.build("queryables"), "Queryables", "GET"));
        }
        for (var collection : collections.collections()) {
            var title = collection.title() != null ? collection.title() : collection.id();
            links.add(Link.of(Relations.CHILD, MediaTypes.JSON, hrefs.build("collections/" + collection.id()), title));
        }
        links.add(Link.of(
                Relations.SERVICE_DESC, MediaTypes.OPENAPI, hrefs.build("api"), "OpenAPI service description"));
        links.add(Link.of(
                Relations.SERVICE_DOC, MediaTypes.HTML, hrefs.build("api.html"), "OpenAPI service documentation"));
        return links;
    }

    @Override
    public Conformance conformance() {
        return new Conformance(registry.conformanceClasses());
    }

    @Override
    public Uni<ItemCollection> getSearch(Map<String, List<String>> queryParameters, StacRequestContext context) {
        var model = requestModels.searchGet();
        return bind(model, () -> RequestModelBinder.bindQuery(model, queryParameters))
                .chain(request -> BackendCalls.observe(
                        metrics, "getSearch", () -> backend.core().getSearch(request, context)));
    }

    @Override
    public Uni<ItemCollection> postSearch(Map<String, Object> body, StacRequestContext context) {
        var model = requestModels.searchPost();
        return bind(model, () -> RequestModelBinder.bindBody(model, body))
                .chain(request -> BackendCalls.observe(
                        metrics, "postSearch", () -> backend.core().postSearch(request, context)));
    }

    @Override
    public Uni<CollectionList> allCollections(StacRequestContext context) {
        return BackendCalls.observe(metrics, "allCollections", () -> backend.core().allCollections(context));
    }

    @Override
    public Uni<StacCollection> getCollection(String collectionId, StacRequestContext context) {
        return BackendCalls.observe(
                metrics, "getCollection", () -> backend.core().getCollection(collectionId, context));
    }

    @Override
    public Uni<ItemCollection> itemCollection(
            String collectionId, Map<String, List<String>> queryParameters, StacRequestContext context) {
        var model = requestModels.itemCollectionGet();
        return bind(model, () -> RequestModelBinder.bindQuery(model, queryParameters))
                .chain(request -> BackendCalls.observe(
                        metrics,
                        "itemCollection",
                        () -> backend.core().itemCollection(collectionId, request, context)));
    }

    @Override
    public Uni<Item> getItem(String collectionId, String itemId, StacRequestContext context) {
        return BackendCalls.observe(
                metrics, "getItem", () -> backend.core().getItem(collectionId, itemId, context));
    }

    private Uni<SearchRequest> bind(RequestModel model, Supplier<SearchRequest> binding) {
        return Uni.createFrom()
                .item(binding)
                .onFailure(IllegalArgumentException.class)
                .invoke(e -> metrics.recordValidationFailure(model.name()));
    }
}
