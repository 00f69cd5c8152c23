package stac.core.model.stac;

import java.util.List;

/**
 * The response of {@code GET /collections}.
 */
public record CollectionList(List<StacCollection> collections, List<Link> links) {

    public CollectionList {
        collections = collections == null ? List.of() : List.copyOf(collections);
        links = links == null ? List.of() : List.copyOf(links);
    }
}
