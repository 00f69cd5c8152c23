package stac.core.service.common;

import java.util.ArrayList;
import java.util.List;

import stac.core.model.forwarding.Header;

/**
 * Lookup and replacement on raw header lists. Header names compare case-insensitively.
 */
public final class HeaderList {

    private HeaderList() {}

    /**
     * Get the value of the first header with the given name.
     *
     * @param headers the header list
     * @param name    header name, any case
     * @return the value, or null if absent
     */
    public static String getValue(List<Header> headers, String name) {
        return getValue(headers, name, null);
    }

    public static String getValue(List<Header> headers, String name, String defaultValue) {
        for (var header : headers) {
            if (header.hasName(name)) {
                return header.value();
            }
        }
        return defaultValue;
    }

    /**
     * Return a copy of the list with the named header set to the given value.
     *
     * <p>The first header with that name is replaced in place and any later duplicates are
     * dropped; if there is none, the header is appended. All other headers keep their order.
     *
     * @param headers the header list
     * @param name    header name, any case
     * @param value   new value
     * @return the new list
     */
    public static List<Header> replaceValue(List<Header> headers, String name, String value) {
        var result = new ArrayList<Header>(headers.size() + 1);
        var replaced = false;
        for (var header : headers) {
            if (!header.hasName(name)) {
                result.add(header);
            } else if (!replaced) {
                result.add(new Header(header.name(), value));
                replaced = true;
            }
        }
        if (!replaced) {
            result.add(new Header(name, value));
        }
        return List.copyOf(result);
    }
}
