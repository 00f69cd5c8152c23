package stac.core.service;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.runtime.Startup;
import org.jboss.logging.Logger;

import stac.core.model.request.ParameterSet;
import stac.core.model.request.RequestMethod;
import stac.core.model.request.RequestModel;
import stac.core.model.request.SearchParameterSets;

/**
 * The request models of the search and item-collection routes, composed once from the enabled
 * extensions.
 *
 * <p>Eagerly initialized so that a misconfigured extension fails the application at boot rather
 * than on the first request.
 */
@Startup
@ApplicationScoped
public class SearchRequestModels {

    public static final String ITEM_COLLECTION_GET_REQUEST = "ItemCollectionGetRequest";

    private static final Logger LOG = Logger.getLogger(SearchRequestModels.class);

    private final RequestModel searchGet;
    private final RequestModel searchPost;
    private final RequestModel itemCollectionGet;

    @Inject
    public SearchRequestModels(ExtensionRegistry registry) {
        this(registry, List.of(), List.of());
    }

    /**
     * Compose the models with additional mixins, e.g. backend-specific search fields.
     *
     * @param registry   enabled extensions
     * @param getMixins  query-kind sets merged into the GET models
     * @param postMixins body-kind sets merged into the POST model
     */
    public SearchRequestModels(
            ExtensionRegistry registry, List<ParameterSet> getMixins, List<ParameterSet> postMixins) {
        var extensions = registry.extensions();
        this.searchGet = RequestModelComposer.compose(
                RequestModelComposer.SEARCH_GET_REQUEST,
                SearchParameterSets.BASE_SEARCH_GET,
                extensions,
                getMixins,
                RequestMethod.GET);
        this.searchPost = RequestModelComposer.compose(
                RequestModelComposer.SEARCH_POST_REQUEST,
                SearchParameterSets.BASE_SEARCH_POST,
                extensions,
                postMixins,
                RequestMethod.POST);
        this.itemCollectionGet = RequestModelComposer.compose(
                ITEM_COLLECTION_GET_REQUEST,
                SearchParameterSets.ITEM_COLLECTION_GET,
                extensions,
                getMixins,
                RequestMethod.GET);
        LOG.infof("Request models: %s; %s; %s", searchGet, searchPost, itemCollectionGet);
    }

    public RequestModel searchGet() {
        return searchGet;
    }

    public RequestModel searchPost() {
        return searchPost;
    }

    public RequestModel itemCollectionGet() {
        return itemCollectionGet;
    }
}
