package stac.core.model.extension;

import java.util.Arrays;
import java.util.Locale;

/**
 * Tag identifying an API extension. Extension lookup compares tags by value.
 */
public enum ExtensionType {
    FILTER("FilterExtension", "filter"),
    CRS("CrsExtension", "crs"),
    TRANSACTION("TransactionExtension", "transaction"),
    PAGINATION("PaginationExtension", "pagination"),
    TOKEN_PAGINATION("TokenPaginationExtension", "token-pagination");

    private final String typeName;
    private final String configName;

    ExtensionType(String typeName, String configName) {
        this.typeName = typeName;
        this.configName = configName;
    }

    /**
     * Declared type name, e.g. {@code FilterExtension}.
     */
    public String typeName() {
        return typeName;
    }

    /**
     * Name used in {@code stac.api.extensions}, e.g. {@code filter}.
     */
    public String configName() {
        return configName;
    }

    /**
     * Resolve a tag from either its config name or its declared type name, ignoring case.
     *
     * @param name the name
     * @return the tag
     * @throws IllegalArgumentException if no extension has that name
     */
    public static ExtensionType fromName(String name) {
        var normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.configName.equals(normalized) || t.typeName.toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown extension: " + name));
    }
}
