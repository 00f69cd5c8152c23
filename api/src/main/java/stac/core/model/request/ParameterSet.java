package stac.core.model.request;

import java.util.HashSet;
import java.util.List;

/**
 * A named, ordered collection of request fields of a single kind.
 *
 * <p>Base request models and extension contributions are both parameter sets; composition
 * merges several of them into one {@link RequestModel}.
 *
 * @param name   set name, used in diagnostics
 * @param kind   whether the fields are query parameters or body members
 * @param fields the field declarations, names unique within the set
 */
public record ParameterSet(String name, ParameterKind kind, List<FieldDescriptor> fields) {

    public ParameterSet {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Parameter set name cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Parameter set kind is required: " + name);
        }
        fields = fields == null ? List.of() : List.copyOf(fields);
        var seen = new HashSet<String>();
        for (var field : fields) {
            if (!seen.add(field.name())) {
                throw new IllegalArgumentException(
                        "Duplicate field '%s' in parameter set %s".formatted(field.name(), name));
            }
        }
    }

    public static ParameterSet query(String name, FieldDescriptor... fields) {
        return new ParameterSet(name, ParameterKind.QUERY, List.of(fields));
    }

    public static ParameterSet body(String name, FieldDescriptor... fields) {
        return new ParameterSet(name, ParameterKind.BODY, List.of(fields));
    }
}
