package stac.core.model.request;

import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Declaration of one request field: its type, wire name, default and validation constraints.
 *
 * @param name           field name used to read the bound value
 * @param type           value type after binding
 * @param alias          wire name when it differs from {@code name} (e.g. {@code filter-lang}), or null
 * @param aliasPriority  priority of the alias over a name-derived alias, or null
 * @param defaultValue   value used when the field is absent, or null
 * @param defaultFactory supplier used instead of {@code defaultValue} when set
 * @param required       whether absence is a validation error
 * @param title          short human readable title, or null
 * @param description    documentation for the field, or null
 * @param constraints    validation constraints, never null
 * @param extra          additional metadata carried through composition unchanged
 */
public record FieldDescriptor(
        String name,
        FieldType type,
        String alias,
        Integer aliasPriority,
        Object defaultValue,
        Supplier<?> defaultFactory,
        boolean required,
        String title,
        String description,
        FieldConstraints constraints,
        Map<String, Object> extra) {

    public FieldDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field name cannot be null or blank");
        }
        Objects.requireNonNull(type, "type");
        if (constraints == null) {
            constraints = FieldConstraints.NONE;
        }
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    public static Builder builder(String name, FieldType type) {
        return new Builder(name, type);
    }

    /**
     * The name the field is read under: its alias when declared, otherwise its name.
     */
    public String wireName() {
        return alias != null ? alias : name;
    }

    /**
     * The value to bind when the field is absent from the request.
     */
    public Object resolveDefault() {
        if (defaultFactory != null) {
            return defaultFactory.get();
        }
        return defaultValue;
    }

    /**
     * Re-derive this declaration as a body parameter.
     *
     * <p>Default, default factory, alias, alias priority, title, description, constraints and extra
     * metadata are preserved. Body parameters are never required: a field declared without a
     * default binds to null when absent.
     *
     * @return the body parameter declaration
     */
    public FieldDescriptor toBodyParameter() {
        return toBuilder().required(false).build();
    }

    public Builder toBuilder() {
        return new Builder(name, type)
                .alias(alias)
                .aliasPriority(aliasPriority)
                .defaultValue(defaultValue)
                .defaultFactory(defaultFactory)
                .required(required)
                .title(title)
                .description(description)
                .constraints(constraints)
                .extra(extra);
    }

    public static final class Builder {
        private final String name;
        private final FieldType type;
        private String alias;
        private Integer aliasPriority;
        private Object defaultValue;
        private Supplier<?> defaultFactory;
        private boolean required;
        private String title;
        private String description;
        private FieldConstraints constraints = FieldConstraints.NONE;
        private Map<String, Object> extra = Map.of();

        private Builder(String name, FieldType type) {
            this.name = name;
            this.type = type;
        }

        public Builder alias(String alias) {
            this.alias = alias;
            return this;
        }

        public Builder aliasPriority(Integer aliasPriority) {
            this.aliasPriority = aliasPriority;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder defaultFactory(Supplier<?> defaultFactory) {
            this.defaultFactory = defaultFactory;
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder constraints(FieldConstraints constraints) {
            this.constraints = constraints;
            return this;
        }

        public Builder extra(Map<String, Object> extra) {
            this.extra = extra;
            return this;
        }

        public FieldDescriptor build() {
            return new FieldDescriptor(
                    name,
                    type,
                    alias,
                    aliasPriority,
                    defaultValue,
                    defaultFactory,
                    required,
                    title,
                    description,
                    constraints,
                    extra);
        }
    }
}
