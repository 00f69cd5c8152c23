package stac.core.model.extension;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import stac.core.model.request.FieldConstraints;
import stac.core.model.request.FieldDescriptor;
import stac.core.model.request.FieldType;
import stac.core.model.request.ParameterSet;
import stac.core.model.request.RequestMethod;

/**
 * Filter extension: CQL filtering of item searches plus the queryables routes.
 *
 * <p>Only the {@code cql-json} filter language is accepted.
 */
public final class FilterExtension implements ApiExtension {

    public static final String CQL_JSON = "cql-json";

    private static final FieldDescriptor FILTER_CRS = FieldDescriptor.builder("filterCrs", FieldType.STRING)
            .alias("filter-crs")
            .defaultValue(CrsUris.CRS84)
            .description("The coordinate reference system (CRS) used by spatial literals in the 'filter' value.")
            .constraints(FieldConstraints.builder().allowedValues(CrsUris.SUPPORTED).build())
            .build();

    private static final FieldDescriptor FILTER_LANG = FieldDescriptor.builder("filterLang", FieldType.STRING)
            .alias("filter-lang")
            .defaultValue(CQL_JSON)
            .description("The CQL filter encoding that the 'filter' value uses.")
            .constraints(FieldConstraints.builder().allowedValues(Set.of(CQL_JSON)).build())
            .build();

    static final ParameterSet GET_REQUEST = ParameterSet.query(
            "FilterExtensionGetRequest",
            FieldDescriptor.builder("filter", FieldType.STRING)
                    .description("A CQL filter expression for filtering items.")
                    .build(),
            FILTER_CRS,
            FILTER_LANG);

    static final ParameterSet POST_REQUEST = ParameterSet.body(
            "FilterExtensionPostRequest",
            FieldDescriptor.builder("filter", FieldType.JSON)
                    .description("A CQL filter expression for filtering items.")
                    .build(),
            FILTER_CRS,
            FILTER_LANG);

    private final List<String> conformanceClasses;
    private final String schemaHref;

    public FilterExtension() {
        this(
                List.of(
                        ConformanceClasses.FILTER,
                        ConformanceClasses.FEATURES_FILTER,
                        ConformanceClasses.ITEM_SEARCH_FILTER,
                        ConformanceClasses.BASIC_CQL2,
                        ConformanceClasses.CQL2_JSON),
                null);
    }

    public FilterExtension(List<String> conformanceClasses, String schemaHref) {
        this.conformanceClasses = List.copyOf(conformanceClasses);
        this.schemaHref = schemaHref;
    }

    @Override
    public ExtensionType type() {
        return ExtensionType.FILTER;
    }

    @Override
    public List<String> conformanceClasses() {
        return conformanceClasses;
    }

    @Override
    public Optional<ParameterSet> requestModel(RequestMethod method) {
        return Optional.of(method == RequestMethod.GET ? GET_REQUEST : POST_REQUEST);
    }

    @Override
    public Optional<String> schemaHref() {
        return Optional.ofNullable(schemaHref);
    }
}
