package stac.core.model.extension;

import java.util.List;
import java.util.Optional;

import stac.core.model.request.FieldConstraints;
import stac.core.model.request.FieldDescriptor;
import stac.core.model.request.FieldType;
import stac.core.model.request.ParameterSet;
import stac.core.model.request.RequestMethod;

/**
 * CRS extension: lets clients choose the response CRS and the CRS of the {@code bbox} parameter.
 */
public final class CrsExtension implements ApiExtension {

    private static final FieldConstraints SUPPORTED_CRS =
            FieldConstraints.builder().allowedValues(CrsUris.SUPPORTED).build();

    private static final FieldDescriptor CRS = FieldDescriptor.builder("crs", FieldType.STRING)
            .defaultValue(CrsUris.CRS84)
            .description("The coordinate reference system of the geometries in the response.")
            .constraints(SUPPORTED_CRS)
            .build();

    private static final FieldDescriptor BBOX_CRS = FieldDescriptor.builder("bboxCrs", FieldType.STRING)
            .alias("bbox-crs")
            .defaultValue(CrsUris.CRS84)
            .description("The coordinate reference system of the bbox parameter.")
            .constraints(SUPPORTED_CRS)
            .build();

    static final ParameterSet GET_REQUEST = ParameterSet.query("CrsExtensionGetRequest", CRS, BBOX_CRS);

    static final ParameterSet POST_REQUEST = ParameterSet.body("CrsExtensionPostRequest", CRS, BBOX_CRS);

    private final List<String> conformanceClasses;

    public CrsExtension() {
        this(List.of(ConformanceClasses.CRS));
    }

    public CrsExtension(List<String> conformanceClasses) {
        this.conformanceClasses = List.copyOf(conformanceClasses);
    }

    @Override
    public ExtensionType type() {
        return ExtensionType.CRS;
    }

    @Override
    public List<String> conformanceClasses() {
        return conformanceClasses;
    }

    @Override
    public Optional<ParameterSet> requestModel(RequestMethod method) {
        return Optional.of(method == RequestMethod.GET ? GET_REQUEST : POST_REQUEST);
    }
}
