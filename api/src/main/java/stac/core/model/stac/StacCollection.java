package stac.core.model.stac;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A STAC Collection, carried as an opaque JSON object.
 */
public record StacCollection(Map<String, Object> document) {

    public static final String TYPE = "Collection";

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public StacCollection {
        if (document == null) {
            throw new IllegalArgumentException("Collection document is required");
        }
        document = Collections.unmodifiableMap(new LinkedHashMap<>(document));
    }

    @Override
    @JsonValue
    public Map<String, Object> document() {
        return document;
    }

    public String id() {
        return StacDocuments.string(document, "id");
    }

    public String title() {
        return StacDocuments.string(document, "title");
    }

    public String type() {
        return StacDocuments.string(document, "type");
    }

    public StacCollection with(String member, Object value) {
        var copy = new LinkedHashMap<>(document);
        copy.put(member, value);
        return new StacCollection(copy);
    }
}
