package stac.core.model.extension;

import java.util.List;
import java.util.Optional;

import stac.core.model.request.ParameterSet;
import stac.core.model.request.RequestMethod;
import stac.core.model.request.SearchParameterSets;

/**
 * Token pagination: contributes the opaque {@code pt} token.
 *
 * <p>The core search models already declare {@code pt} identically, so enabling this extension
 * there is a no-op; it matters for base models that do not.
 */
public final class TokenPaginationExtension implements ApiExtension {

    static final ParameterSet GET_REQUEST = ParameterSet.query("GETTokenPagination", SearchParameterSets.PT);
    static final ParameterSet POST_REQUEST = ParameterSet.body("POSTTokenPagination", SearchParameterSets.PT);

    @Override
    public ExtensionType type() {
        return ExtensionType.TOKEN_PAGINATION;
    }

    @Override
    public List<String> conformanceClasses() {
        return List.of();
    }

    @Override
    public Optional<ParameterSet> requestModel(RequestMethod method) {
        return Optional.of(method == RequestMethod.GET ? GET_REQUEST : POST_REQUEST);
    }
}
