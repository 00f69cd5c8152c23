package stac.core.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jboss.logging.Logger;

import stac.core.model.extension.ApiExtension;
import stac.core.model.request.FieldDescriptor;
import stac.core.model.request.ParameterKind;
import stac.core.model.request.ParameterSet;
import stac.core.model.request.RequestMethod;
import stac.core.model.request.RequestModel;
import stac.core.model.request.RequestModelCompositionException;

/**
 * Composes the concrete request model of a route from a base parameter set, the parameter sets
 * contributed by enabled extensions, and optional extra mixins.
 *
 * <p>Merge order is base first, then extensions in registration order, then mixins. Field
 * collisions are resolved explicitly:
 * <ul>
 *   <li>the same field declared identically more than once is kept once, at its first position</li>
 *   <li>the same field name declared differently fails composition</li>
 *   <li>two different fields sharing one wire name (alias) fail composition</li>
 * </ul>
 * All contributing sets must be of the kind the HTTP method expects; a mixed list fails
 * composition. Composition happens once at startup, so every failure here is a configuration error.
 */
public final class RequestModelComposer {

    public static final String SEARCH_GET_REQUEST = "SearchGetRequest";
    public static final String SEARCH_POST_REQUEST = "SearchPostRequest";

    private static final Logger LOG = Logger.getLogger(RequestModelComposer.class);

    private RequestModelComposer() {}

    /**
     * Compose a request model.
     *
     * @param modelName  name of the resulting model
     * @param base       base parameter set; becomes the model's parent
     * @param extensions enabled extensions, in merge order
     * @param mixins     additional parameter sets merged after the extensions, may be empty
     * @param method     HTTP method of the route
     * @return the composed model
     * @throws RequestModelCompositionException on mixed kinds or conflicting fields
     */
    public static RequestModel compose(
            String modelName,
            ParameterSet base,
            List<? extends ApiExtension> extensions,
            List<ParameterSet> mixins,
            RequestMethod method) {

        var models = new ArrayList<ParameterSet>();
        models.add(base);
        for (var extension : extensions) {
            extension.requestModel(method).ifPresent(models::add);
        }
        if (mixins != null) {
            models.addAll(mixins);
        }

        var kind = requireSingleKind(modelName, models, method);

        var byName = new LinkedHashMap<String, FieldDescriptor>();
        var origin = new LinkedHashMap<String, String>();
        var wireNames = new LinkedHashMap<String, String>();
        for (var model : models) {
            for (var declared : model.fields()) {
                var field = kind == ParameterKind.BODY ? declared.toBodyParameter() : declared;
                merge(modelName, model.name(), field, byName, origin, wireNames);
            }
        }

        var lineage = models.stream().map(ParameterSet::name).toList();
        var composed = new RequestModel(modelName, kind, base.name(), lineage, List.copyOf(byName.values()));
        LOG.debugf("Composed %s from %s", composed, lineage);
        return composed;
    }

    public static RequestModel searchGetModel(ParameterSet base, List<? extends ApiExtension> extensions) {
        return compose(SEARCH_GET_REQUEST, base, extensions, List.of(), RequestMethod.GET);
    }

    public static RequestModel searchPostModel(ParameterSet base, List<? extends ApiExtension> extensions) {
        return compose(SEARCH_POST_REQUEST, base, extensions, List.of(), RequestMethod.POST);
    }

    private static ParameterKind requireSingleKind(String modelName, List<ParameterSet> models, RequestMethod method) {
        var kinds = models.stream().map(ParameterSet::kind).distinct().toList();
        if (kinds.size() > 1) {
            throw new RequestModelCompositionException(
                    "Mixed request model kinds for %s: %s. Check extension request types."
                            .formatted(modelName, describe(models)));
        }
        var kind = kinds.get(0);
        if (kind != method.kind()) {
            throw new RequestModelCompositionException("Request model %s for %s must be %s but got %s: %s"
                    .formatted(modelName, method, method.kind(), kind, describe(models)));
        }
        return kind;
    }

    private static void merge(
            String modelName,
            String setName,
            FieldDescriptor field,
            Map<String, FieldDescriptor> byName,
            Map<String, String> origin,
            Map<String, String> wireNames) {

        var existing = byName.get(field.name());
        if (existing != null) {
            if (!existing.equals(field)) {
                throw new RequestModelCompositionException(
                        "Field '%s' of %s conflicts with the declaration from %s in %s"
                                .formatted(field.name(), setName, origin.get(field.name()), modelName));
            }
            LOG.debugf("Field '%s' of %s already declared by %s", field.name(), setName, origin.get(field.name()));
            return;
        }

        var owner = wireNames.get(field.wireName());
        if (owner != null) {
            throw new RequestModelCompositionException(
                    "Wire name '%s' of field '%s' (%s) is already used by field '%s' in %s"
                            .formatted(field.wireName(), field.name(), setName, owner, modelName));
        }

        byName.put(field.name(), field);
        origin.put(field.name(), setName);
        wireNames.put(field.wireName(), field.name());
    }

    private static String describe(List<ParameterSet> models) {
        return models.stream().map(m -> m.name() + "(" + m.kind() + ")").toList().toString();
    }
}
