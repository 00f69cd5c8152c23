package stac.core.model.stac;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The API landing page served at {@code /}.
 */
public record LandingPage(
        String type,
        String id,
        String title,
        String description,
        @JsonProperty("stac_version") String stacVersion,
        List<String> conformsTo,
        List<Link> links,
        @JsonProperty("stac_extensions") List<String> stacExtensions) {

    public static final String CATALOG = "Catalog";

    public LandingPage {
        conformsTo = conformsTo == null ? List.of() : List.copyOf(conformsTo);
        links = links == null ? List.of() : List.copyOf(links);
        stacExtensions = stacExtensions == null ? List.of() : List.copyOf(stacExtensions);
    }
}
