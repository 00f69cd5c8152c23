package stac.core.model.stac;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A link object as used in STAC and OGC API documents.
 *
 * @param rel    relation type
 * @param type   media type of the target, or null
 * @param href   absolute target URL
 * @param title  human readable title, or null
 * @param method HTTP method for links that are not plain GETs (e.g. search via POST), or null
 * @param body   request body to send when following a POST link, or null
 * @param merge  whether {@code body} is merged into the previous request body, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Link(
        String rel, String type, String href, String title, String method, Map<String, Object> body, Boolean merge) {

    public Link {
        if (rel == null || rel.isBlank()) {
            throw new IllegalArgumentException("Link rel is required");
        }
        if (href == null || href.isBlank()) {
            throw new IllegalArgumentException("Link href is required");
        }
    }

    public Link(String rel, String type, String href, String title, String method) {
        this(rel, type, href, title, method, null, null);
    }

    public static Link of(String rel, String type, String href) {
        return new Link(rel, type, href, null, null);
    }

    public static Link of(String rel, String type, String href, String title) {
        return new Link(rel, type, href, title, null);
    }
}
