package stac.core.model.request;

/**
 * Base parameter sets of the core STAC routes, before extensions contribute their fields.
 */
public final class SearchParameterSets {

    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 10_000;

    private static final FieldConstraints LIMIT_BOUNDS =
            FieldConstraints.builder().ge(1).le(MAX_LIMIT).build();

    private static final FieldConstraints BBOX_SIZE =
            FieldConstraints.builder().minItems(4).maxItems(6).build();

    static final FieldDescriptor COLLECTIONS = FieldDescriptor.builder("collections", FieldType.STRING_LIST)
            .description("Array of Collection IDs to include in the search for items. "
                    + "Only Item objects in one of the provided collections will be searched.")
            .build();

    static final FieldDescriptor IDS = FieldDescriptor.builder("ids", FieldType.STRING_LIST)
            .description("Array of Item ids to return.")
            .build();

    static final FieldDescriptor BBOX = FieldDescriptor.builder("bbox", FieldType.BBOX)
            .description("Only return items intersecting this bounding box. "
                    + "Mutually exclusive with **intersects**.")
            .constraints(BBOX_SIZE)
            .build();

    static final FieldDescriptor DATETIME = FieldDescriptor.builder("datetime", FieldType.DATETIME)
            .description("Only return items that have a temporal property that intersects this value. "
                    + "Either a date-time or an interval, open or closed.")
            .build();

    static final FieldDescriptor LIMIT = FieldDescriptor.builder("limit", FieldType.INTEGER)
            .defaultValue(DEFAULT_LIMIT)
            .description("Limits the number of results that are included in each page of the response.")
            .constraints(LIMIT_BOUNDS)
            .build();

    public static final FieldDescriptor PT = FieldDescriptor.builder("pt", FieldType.STRING)
            .description("Opaque pagination token returned in a previous page's next link.")
            .build();

    public static final ParameterSet BASE_SEARCH_GET = ParameterSet.query(
            "BaseSearchGetRequest",
            COLLECTIONS,
            IDS,
            BBOX,
            FieldDescriptor.builder("intersects", FieldType.JSON)
                    .description("Only return items intersecting this GeoJSON Geometry. "
                            + "Mutually exclusive with **bbox**.")
                    .build(),
            DATETIME,
            LIMIT,
            FieldDescriptor.builder("query", FieldType.JSON)
                    .description("Property filter expression as a JSON object.")
                    .build(),
            PT,
            FieldDescriptor.builder("fields", FieldType.STRING_LIST)
                    .description("Include or exclude fields from items; prefix with '-' to exclude.")
                    .build(),
            FieldDescriptor.builder("sortby", FieldType.STRING_LIST)
                    .description("Sort fields; prefix with '+' or '-' for direction.")
                    .build());

    public static final ParameterSet BASE_SEARCH_POST = ParameterSet.body(
            "BaseSearchPostRequest",
            COLLECTIONS,
            IDS,
            BBOX,
            FieldDescriptor.builder("intersects", FieldType.JSON)
                    .description("Only return items intersecting this GeoJSON Geometry.")
                    .build(),
            DATETIME,
            LIMIT,
            FieldDescriptor.builder("query", FieldType.JSON)
                    .description("Property filter expression.")
                    .build(),
            PT,
            FieldDescriptor.builder("fields", FieldType.JSON)
                    .description("Object with include and exclude arrays of field names.")
                    .build(),
            FieldDescriptor.builder("sortby", FieldType.JSON)
                    .description("Array of {field, direction} sort objects.")
                    .build());

    public static final ParameterSet ITEM_COLLECTION_GET =
            ParameterSet.query("ItemCollectionUri", LIMIT, BBOX, DATETIME, PT);

    private SearchParameterSets() {}
}
