package stac.core.model.stac;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A page of items (GeoJSON FeatureCollection) returned by searches and item listings.
 *
 * @param type           always {@code FeatureCollection}
 * @param features       the items of this page
 * @param links          paging and navigation links
 * @param numberMatched  total number of matching items, or null when unknown
 * @param numberReturned number of items in this page, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ItemCollection(
        String type, List<Item> features, List<Link> links, Integer numberMatched, Integer numberReturned) {

    public static final String TYPE = "FeatureCollection";

    public ItemCollection {
        if (type == null) {
            type = TYPE;
        }
        features = features == null ? List.of() : List.copyOf(features);
        links = links == null ? List.of() : List.copyOf(links);
    }

    public static ItemCollection of(List<Item> features, List<Link> links) {
        return new ItemCollection(TYPE, features, links, null, features.size());
    }
}
