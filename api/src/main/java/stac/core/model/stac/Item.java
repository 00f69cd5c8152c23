package stac.core.model.stac;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A STAC Item (GeoJSON Feature).
 *
 * <p>The document shape is owned by the STAC specification; this type carries it as an
 * opaque JSON object and exposes only the members the API layer needs.
 */
public record Item(Map<String, Object> document) {

    public static final String TYPE = "Feature";

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public Item {
        if (document == null) {
            throw new IllegalArgumentException("Item document is required");
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

    public String collection() {
        return StacDocuments.string(document, "collection");
    }

    public String type() {
        return StacDocuments.string(document, "type");
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> properties() {
        var properties = document.get("properties");
        return properties instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    /**
     * Copy of this item with one top-level member replaced.
     */
    public Item with(String member, Object value) {
        var copy = new LinkedHashMap<>(document);
        copy.put(member, value);
        return new Item(copy);
    }
}
