package stac.core.model.stac;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Queryables documents (JSON Schema) served by the Filter extension.
 */
public final class Queryables {

    public static final String JSON_SCHEMA_DIALECT = "https://json-schema.org/draft/2019-09/schema";

    private Queryables() {}

    /**
     * A queryables schema with no properties.
     *
     * <p>Not allowed under OGC CQL but allowed by the STAC API Filter extension; served when a
     * backend does not describe its queryables.
     *
     * @return a new mutable schema document
     */
    public static Map<String, Object> emptySchema() {
        var schema = new LinkedHashMap<String, Object>();
        schema.put("$schema", JSON_SCHEMA_DIALECT);
        schema.put("$id", "https://example.org/queryables");
        schema.put("type", "object");
        schema.put("title", "Queryables for Example STAC API");
        schema.put("description", "Queryable names for the example STAC API Item Search filter.");
        schema.put("properties", new LinkedHashMap<String, Object>());
        return schema;
    }
}
