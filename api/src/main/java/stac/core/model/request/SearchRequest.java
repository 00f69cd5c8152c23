package stac.core.model.request;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A request bound against a {@link RequestModel}: one value (possibly null) per model field,
 * keyed by field name.
 *
 * <p>Accessors cover the core search fields; fields contributed by extensions are read with
 * {@link #get(String)}.
 *
 * @param model  name of the request model the values were bound with
 * @param values bound values keyed by field name
 */
public record SearchRequest(String model, Map<String, Object> values) {

    public SearchRequest {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Object get(String fieldName) {
        return values.get(fieldName);
    }

    public boolean has(String fieldName) {
        return values.get(fieldName) != null;
    }

    public String getString(String fieldName) {
        var value = values.get(fieldName);
        return value == null ? null : value.toString();
    }

    @SuppressWarnings("unchecked")
    public List<String> collections() {
        return (List<String>) values.get("collections");
    }

    @SuppressWarnings("unchecked")
    public List<String> ids() {
        return (List<String>) values.get("ids");
    }

    @SuppressWarnings("unchecked")
    public List<Double> bbox() {
        return (List<Double>) values.get("bbox");
    }

    public DatetimeInterval datetime() {
        return (DatetimeInterval) values.get("datetime");
    }

    public Integer limit() {
        return (Integer) values.get("limit");
    }

    public Object intersects() {
        return values.get("intersects");
    }

    public Object query() {
        return values.get("query");
    }

    public Object fields() {
        return values.get("fields");
    }

    public Object sortby() {
        return values.get("sortby");
    }

    /**
     * The opaque pagination token.
     */
    public String pt() {
        return getString("pt");
    }
}
