package stac.core.model.request;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validation constraints attached to a request field.
 *
 * <p>All members are optional. Numeric bounds apply to INTEGER and NUMBER values, length bounds
 * and pattern to strings, item bounds to lists and bounding boxes.
 */
public record FieldConstraints(
        BigDecimal gt,
        BigDecimal ge,
        BigDecimal lt,
        BigDecimal le,
        BigDecimal multipleOf,
        Integer minLength,
        Integer maxLength,
        Integer minItems,
        Integer maxItems,
        String pattern,
        Set<String> allowedValues) {

    public static final FieldConstraints NONE = builder().build();

    public FieldConstraints {
        allowedValues = allowedValues == null ? Set.of() : Set.copyOf(allowedValues);
        if (pattern != null) {
            // throws PatternSyntaxException for a malformed pattern
            Pattern.compile(pattern);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .gt(gt)
                .ge(ge)
                .lt(lt)
                .le(le)
                .multipleOf(multipleOf)
                .minLength(minLength)
                .maxLength(maxLength)
                .minItems(minItems)
                .maxItems(maxItems)
                .pattern(pattern)
                .allowedValues(allowedValues);
    }

    /**
     * Check a bound value against these constraints.
     *
     * @param field the field name, used in messages
     * @param value the bound value, never null
     * @throws IllegalArgumentException if a constraint is violated
     */
    public void check(String field, Object value) {
        if (value instanceof Number number) {
            checkNumber(field, new BigDecimal(number.toString()));
        } else if (value instanceof String text) {
            checkString(field, text);
        } else if (value instanceof Collection<?> items) {
            checkItems(field, items.size());
        }
    }

    private void checkNumber(String field, BigDecimal value) {
        if (gt != null && value.compareTo(gt) <= 0) {
            throw violation(field, "must be greater than " + gt.toPlainString());
        }
        if (ge != null && value.compareTo(ge) < 0) {
            throw violation(field, "must be greater than or equal to " + ge.toPlainString());
        }
        if (lt != null && value.compareTo(lt) >= 0) {
            throw violation(field, "must be less than " + lt.toPlainString());
        }
        if (le != null && value.compareTo(le) > 0) {
            throw violation(field, "must be less than or equal to " + le.toPlainString());
        }
        if (multipleOf != null && value.remainder(multipleOf).signum() != 0) {
            throw violation(field, "must be a multiple of " + multipleOf.toPlainString());
        }
    }

    private void checkString(String field, String value) {
        if (minLength != null && value.length() < minLength) {
            throw violation(field, "must have at least " + minLength + " characters");
        }
        if (maxLength != null && value.length() > maxLength) {
            throw violation(field, "must have at most " + maxLength + " characters");
        }
        if (pattern != null && !Pattern.compile(pattern).matcher(value).matches()) {
            throw violation(field, "must match pattern " + pattern);
        }
        if (!allowedValues.isEmpty() && !allowedValues.contains(value)) {
            throw violation(field, "must be one of " + List.copyOf(allowedValues));
        }
    }

    private void checkItems(String field, int size) {
        if (minItems != null && size < minItems) {
            throw violation(field, "must have at least " + minItems + " items");
        }
        if (maxItems != null && size > maxItems) {
            throw violation(field, "must have at most " + maxItems + " items");
        }
    }

    private static IllegalArgumentException violation(String field, String message) {
        return new IllegalArgumentException("Invalid value for '" + field + "': " + message);
    }

    public static final class Builder {
        private BigDecimal gt;
        private BigDecimal ge;
        private BigDecimal lt;
        private BigDecimal le;
        private BigDecimal multipleOf;
        private Integer minLength;
        private Integer maxLength;
        private Integer minItems;
        private Integer maxItems;
        private String pattern;
        private Set<String> allowedValues;

        private Builder() {}

        public Builder gt(BigDecimal gt) {
            this.gt = gt;
            return this;
        }

        public Builder gt(long gt) {
            return gt(BigDecimal.valueOf(gt));
        }

        public Builder ge(BigDecimal ge) {
            this.ge = ge;
            return this;
        }

        public Builder ge(long ge) {
            return ge(BigDecimal.valueOf(ge));
        }

        public Builder lt(BigDecimal lt) {
            this.lt = lt;
            return this;
        }

        public Builder lt(long lt) {
            return lt(BigDecimal.valueOf(lt));
        }

        public Builder le(BigDecimal le) {
            this.le = le;
            return this;
        }

        public Builder le(long le) {
            return le(BigDecimal.valueOf(le));
        }

        public Builder multipleOf(BigDecimal multipleOf) {
            this.multipleOf = multipleOf;
            return this;
        }

        public Builder minLength(Integer minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder maxLength(Integer maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder minItems(Integer minItems) {
            this.minItems = minItems;
            return this;
        }

        public Builder maxItems(Integer maxItems) {
            this.maxItems = maxItems;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder allowedValues(Set<String> allowedValues) {
            this.allowedValues = allowedValues;
            return this;
        }

        public FieldConstraints build() {
            return new FieldConstraints(
                    gt, ge, lt, le, multipleOf, minLength, maxLength, minItems, maxItems, pattern, allowedValues);
        }
    }
}
