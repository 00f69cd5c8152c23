package stac.core.model.request;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A composed request type bound to one route: the flattened field list of a base parameter set
 * and every contributed extension and mixin set.
 *
 * <p>Instances are created once at startup and are immutable.
 */
public final class RequestModel {

    private final String name;
    private final ParameterKind kind;
    private final String parent;
    private final List<String> lineage;
    private final List<FieldDescriptor> fields;
    private final Map<String, FieldDescriptor> byName;
    private final Map<String, FieldDescriptor> byWireName;

    public RequestModel(
            String name, ParameterKind kind, String parent, List<String> lineage, List<FieldDescriptor> fields) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Request model name cannot be null or blank");
        }
        this.name = name;
        this.kind = kind;
        this.parent = parent;
        this.lineage = List.copyOf(lineage);
        this.fields = List.copyOf(fields);

        var names = new LinkedHashMap<String, FieldDescriptor>();
        var wireNames = new LinkedHashMap<String, FieldDescriptor>();
        for (var field : this.fields) {
            names.put(field.name(), field);
            wireNames.put(field.wireName(), field);
        }
        this.byName = Map.copyOf(names);
        this.byWireName = Map.copyOf(wireNames);
    }

    public String name() {
        return name;
    }

    public ParameterKind kind() {
        return kind;
    }

    /**
     * Name of the base parameter set this model extends.
     */
    public String parent() {
        return parent;
    }

    /**
     * Names of the parameter sets merged into this model, base first, in merge order.
     */
    public List<String> lineage() {
        return lineage;
    }

    public List<FieldDescriptor> fields() {
        return fields;
    }

    public Optional<FieldDescriptor> field(String fieldName) {
        return Optional.ofNullable(byName.get(fieldName));
    }

    public Optional<FieldDescriptor> fieldByWireName(String wireName) {
        return Optional.ofNullable(byWireName.get(wireName));
    }

    public boolean hasField(String fieldName) {
        return byName.containsKey(fieldName);
    }

    @Override
    public String toString() {
        return "RequestModel[" + name + ", " + kind + ", fields="
                + fields.stream().map(FieldDescriptor::wireName).toList() + "]";
    }
}
