package stac.core.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import stac.core.model.request.DatetimeInterval;
import stac.core.model.request.FieldDescriptor;
import stac.core.model.request.FieldType;
import stac.core.model.request.ParameterKind;
import stac.core.model.request.RequestModel;
import stac.core.model.request.SearchRequest;

/**
 * Binds raw request input against a composed {@link RequestModel}.
 *
 * <p>Fields are read by wire name. Absent fields take their declared default; absent required
 * fields, unparseable values and constraint violations raise {@link IllegalArgumentException}.
 * Unknown parameters and body members are ignored.
 */
public final class RequestModelBinder {

    private RequestModelBinder() {}

    /**
     * Bind query-string parameters.
     *
     * @param model       a query-kind model
     * @param queryParams decoded parameters; repeated names keep every value
     * @return the bound request
     */
    public static SearchRequest bindQuery(RequestModel model, Map<String, List<String>> queryParams) {
        requireKind(model, ParameterKind.QUERY);
        var values = new LinkedHashMap<String, Object>();
        for (var field : model.fields()) {
            var raw = queryParams.get(field.wireName());
            var value = raw == null || raw.isEmpty() ? null : fromQuery(field, raw);
            values.put(field.name(), finish(field, value, raw != null && !raw.isEmpty()));
        }
        return new SearchRequest(model.name(), values);
    }

    /**
     * Bind the members of a JSON object body.
     *
     * @param model a body-kind model
     * @param body  the parsed body; null is treated as an empty object
     * @return the bound request
     */
    public static SearchRequest bindBody(RequestModel model, Map<String, Object> body) {
        requireKind(model, ParameterKind.BODY);
        var input = body == null ? Map.<String, Object>of() : body;
        var values = new LinkedHashMap<String, Object>();
        for (var field : model.fields()) {
            var present = input.containsKey(field.wireName());
            var raw = input.get(field.wireName());
            var value = raw == null ? null : fromJson(field, raw);
            values.put(field.name(), finish(field, value, present));
        }
        return new SearchRequest(model.name(), values);
    }

    private static void requireKind(RequestModel model, ParameterKind kind) {
        if (model.kind() != kind) {
            throw new IllegalStateException("Request model " + model.name() + " is " + model.kind() + ", not " + kind);
        }
    }

    private static Object finish(FieldDescriptor field, Object value, boolean present) {
        if (value == null) {
            if (present) {
                return null;
            }
            if (field.required()) {
                throw new IllegalArgumentException("Missing required parameter '" + field.wireName() + "'");
            }
            return field.resolveDefault();
        }
        if (field.type() == FieldType.BBOX) {
            checkBbox(field, value);
        }
        field.constraints().check(field.wireName(), value);
        return value;
    }

    private static Object fromQuery(FieldDescriptor field, List<String> raw) {
        var text = raw.get(raw.size() - 1);
        return switch (field.type()) {
            case STRING, JSON -> text;
            case INTEGER -> parseInteger(field, text);
            case NUMBER -> parseNumber(field, text);
            case BOOLEAN -> parseBoolean(field, text);
            case STRING_LIST -> splitAll(raw);
            case BBOX -> splitAll(raw).stream().map(part -> parseNumber(field, part)).toList();
            case DATETIME -> DatetimeInterval.parse(text);
        };
    }

    // Rejects fractions and values outside the int range instead of truncating them.
    private static int exactInt(FieldDescriptor field, Number number) {
        try {
            return new BigDecimal(number.toString()).intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw invalid(field, "expected an integer");
        }
    }

    private static Object fromJson(FieldDescriptor field, Object raw) {
        return switch (field.type()) {
            case STRING -> {
                if (!(raw instanceof String)) {
                    throw invalid(field, "expected a string");
                }
                yield raw;
            }
            case INTEGER -> {
                if (!(raw instanceof Number number)) {
                    throw invalid(field, "expected an integer");
                }
                yield exactInt(field, number);
            }
            case NUMBER -> {
                if (!(raw instanceof Number number)) {
                    throw invalid(field, "expected a number");
                }
                yield finite(field, number.doubleValue());
            }
            case BOOLEAN -> {
                if (!(raw instanceof Boolean)) {
                    throw invalid(field, "expected a boolean");
                }
                yield raw;
            }
            case STRING_LIST -> {
                if (!(raw instanceof List<?> items) || !items.stream().allMatch(String.class::isInstance)) {
                    throw invalid(field, "expected an array of strings");
                }
                yield items.stream().map(String.class::cast).toList();
            }
            case BBOX -> {
                if (!(raw instanceof List<?> items) || !items.stream().allMatch(Number.class::isInstance)) {
                    throw invalid(field, "expected an array of numbers");
                }
                yield items.stream()
                        .map(n -> finite(field, ((Number) n).doubleValue()))
                        .toList();
            }
            case DATETIME -> {
                if (!(raw instanceof String text)) {
                    throw invalid(field, "expected a string");
                }
                yield DatetimeInterval.parse(text);
            }
            case JSON -> raw;
        };
    }

    private static List<String> splitAll(List<String> raw) {
        var result = new ArrayList<String>();
        for (var value : raw) {
            for (var part : value.split(",")) {
                var trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    result.add(trimmed);
                }
            }
        }
        return List.copyOf(result);
    }

    private static Integer parseInteger(FieldDescriptor field, String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw invalid(field, "expected an integer but got '" + text + "'");
        }
    }

    private static Double parseNumber(FieldDescriptor field, String text) {
        try {
            return finite(field, Double.parseDouble(text.trim()));
        } catch (NumberFormatException e) {
            throw invalid(field, "expected a number but got '" + text + "'");
        }
    }

    private static Boolean parseBoolean(FieldDescriptor field, String text) {
        var value = text.trim();
        if ("true".equalsIgnoreCase(value)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(value)) {
            return Boolean.FALSE;
        }
        throw invalid(field, "expected true or false but got '" + text + "'");
    }

    private static Double finite(FieldDescriptor field, double value) {
        if (!Double.isFinite(value)) {
            throw invalid(field, "expected a finite number");
        }
        return value;
    }

    private static void checkBbox(FieldDescriptor field, Object value) {
        var size = ((List<?>) value).size();
        if (size != 4 && size != 6) {
            throw invalid(field, "expected 4 or 6 coordinates but got " + size);
        }
    }

    private static IllegalArgumentException invalid(FieldDescriptor field, String message) {
        return new IllegalArgumentException("Invalid value for '" + field.wireName() + "': " + message);
    }
}
