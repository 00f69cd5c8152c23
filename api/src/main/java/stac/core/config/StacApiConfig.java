package stac.core.config;

import java.util.List;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the API surface.
 *
 * <p>Configuration prefix: {@code stac.api}
 */
@ConfigMapping(prefix = "stac.api")
public interface StacApiConfig {

    /**
     * Identifier of the landing page catalog.
     */
    @WithDefault("stac-api")
    String landingId();

    @WithDefault("STAC API")
    String title();

    @WithDefault("STAC API")
    String description();

    /**
     * STAC version advertised on the landing page.
     */
    @WithDefault("1.0.0")
    String stacVersion();

    /**
     * Enabled extensions, by config name ({@code filter}, {@code crs}, {@code transaction},
     * {@code pagination}, {@code token-pagination}).
     *
     * <p>Order matters: it is the order in which extension fields are merged into request models.
     *
     * @return enabled extension names
     */
    @WithDefault("filter,crs,transaction,pagination")
    List<String> extensions();

    ForwardingConfig forwarding();

    interface ForwardingConfig {

        /**
         * When true, response links are built from the {@code Forwarded} / {@code X-Forwarded-*}
         * headers of the request. When false, the raw request base URL is used.
         */
        @WithDefault("true")
        boolean trustProxyHeaders();
    }
}
