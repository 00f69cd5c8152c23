package stac.core.model.stac;

import java.util.Map;

final class StacDocuments {

    private StacDocuments() {}

    static String string(Map<String, Object> document, String member) {
        var value = document.get(member);
        return value == null ? null : value.toString();
    }
}
