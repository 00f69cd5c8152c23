package stac.core.model.request;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * A datetime search value: a single RFC 3339 instant or a closed/half-open interval.
 *
 * <p>Accepted forms: {@code 2020-01-01T00:00:00Z}, {@code 2020-01-01T00:00:00Z/2021-01-01T00:00:00Z},
 * {@code ../2021-01-01T00:00:00Z}, {@code 2020-01-01T00:00:00Z/..}. An empty side is treated as open.
 *
 * @param start inclusive start, or null when open
 * @param end   inclusive end, or null when open
 * @param text  the original text
 */
public record DatetimeInterval(Instant start, Instant end, String text) {

    private static final String OPEN = "..";

    public DatetimeInterval {
        if (start != null && end != null && start.isAfter(end)) {
            throw new IllegalArgumentException("Invalid datetime interval: start is after end: " + text);
        }
    }

    /**
     * Parse a datetime search value.
     *
     * @param text the value
     * @return the interval
     * @throws IllegalArgumentException if the value is malformed
     */
    public static DatetimeInterval parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("datetime cannot be blank");
        }
        var value = text.trim();
        var slash = value.indexOf('/');
        if (slash < 0) {
            var instant = parseInstant(value);
            return new DatetimeInterval(instant, instant, value);
        }
        var start = parseBound(value.substring(0, slash));
        var end = parseBound(value.substring(slash + 1));
        if (start == null && end == null) {
            throw new IllegalArgumentException("Invalid datetime interval: both ends are open: " + value);
        }
        return new DatetimeInterval(start, end, value);
    }

    public boolean isInstant() {
        return start != null && start.equals(end);
    }

    public boolean contains(Instant instant) {
        if (instant == null) {
            return false;
        }
        if (start != null && instant.isBefore(start)) {
            return false;
        }
        return end == null || !instant.isAfter(end);
    }

    private static Instant parseBound(String value) {
        if (value.isEmpty() || OPEN.equals(value)) {
            return null;
        }
        return parseInstant(value);
    }

    private static Instant parseInstant(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid RFC 3339 datetime: " + value, e);
        }
    }
}
