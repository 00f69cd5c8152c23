package stac.core.model.extension;

import java.util.List;
import java.util.Optional;

import stac.core.model.request.FieldDescriptor;
import stac.core.model.request.FieldType;
import stac.core.model.request.ParameterSet;
import stac.core.model.request.RequestMethod;

/**
 * Page-number pagination: contributes a {@code page} field to GET and POST searches.
 */
public final class PaginationExtension implements ApiExtension {

    private static final FieldDescriptor PAGE = FieldDescriptor.builder("page", FieldType.STRING)
            .description("Page of results to return.")
            .build();

    static final ParameterSet GET_REQUEST = ParameterSet.query("GETPagination", PAGE);
    static final ParameterSet POST_REQUEST = ParameterSet.body("POSTPagination", PAGE);

    @Override
    public ExtensionType type() {
        return ExtensionType.PAGINATION;
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
