package stac.core.model.stac;

import java.util.List;

/**
 * Conformance declaration served at {@code /conformance}.
 */
public record Conformance(List<String> conformsTo) {

    public Conformance {
        conformsTo = conformsTo == null ? List.of() : List.copyOf(conformsTo);
    }
}
