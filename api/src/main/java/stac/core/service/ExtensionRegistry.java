package stac.core.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import stac.core.config.StacApiConfig;
import stac.core.model.common.ResourceNotFoundException;
import stac.core.model.extension.ApiExtension;
import stac.core.model.extension.ConformanceClasses;
import stac.core.model.extension.CrsExtension;
import stac.core.model.extension.ExtensionType;
import stac.core.model.extension.FilterExtension;
import stac.core.model.extension.PaginationExtension;
import stac.core.model.extension.TokenPaginationExtension;
import stac.core.model.extension.TransactionExtension;

/**
 * Ordered list of enabled API extensions plus the base conformance classes.
 *
 * <p>Built once at startup and read-only afterwards.
 */
@ApplicationScoped
public class ExtensionRegistry {

    private static final Logger LOG = Logger.getLogger(ExtensionRegistry.class);

    private final List<ApiExtension> extensions;
    private final List<String> baseConformanceClasses;

    @Inject
    public ExtensionRegistry(StacApiConfig config) {
        this(fromNames(config.extensions()), ConformanceClasses.BASE);
        LOG.infof(
                "Enabled extensions: %s",
                extensions.stream().map(e -> e.type().typeName()).toList());
    }

    public ExtensionRegistry(List<? extends ApiExtension> extensions, List<String> baseConformanceClasses) {
        var seen = new LinkedHashSet<ExtensionType>();
        for (var extension : extensions) {
            if (!seen.add(extension.type())) {
                throw new IllegalArgumentException("Extension registered twice: " + extension.type().typeName());
            }
        }
        this.extensions = List.copyOf(extensions);
        this.baseConformanceClasses = List.copyOf(baseConformanceClasses);
    }

    /**
     * Create the default extension instance for each configured name.
     *
     * @param names extension names in merge order
     * @return the extensions
     * @throws IllegalArgumentException on an unknown name
     */
    public static List<ApiExtension> fromNames(List<String> names) {
        var result = new ArrayList<ApiExtension>();
        for (var name : names) {
            if (name == null || name.isBlank()) {
                continue;
            }
            result.add(
                    switch (ExtensionType.fromName(name)) {
                        case FILTER -> new FilterExtension();
                        case CRS -> new CrsExtension();
                        case TRANSACTION -> new TransactionExtension();
                        case PAGINATION -> new PaginationExtension();
                        case TOKEN_PAGINATION -> new TokenPaginationExtension();
                    });
        }
        return result;
    }

    public List<ApiExtension> extensions() {
        return extensions;
    }

    /**
     * Base conformance classes followed by every enabled extension's classes, without duplicates.
     */
    public List<String> conformanceClasses() {
        var classes = new LinkedHashSet<>(baseConformanceClasses);
        for (var extension : extensions) {
            classes.addAll(extension.conformanceClasses());
        }
        return List.copyOf(classes);
    }

    public boolean isEnabled(ExtensionType type) {
        return extensions.stream().anyMatch(e -> e.type() == type);
    }

    /**
     * Look up an enabled extension.
     *
     * @param type the extension tag
     * @return the extension
     * @throws ResourceNotFoundException if it is not enabled
     */
    public ApiExtension getExtension(ExtensionType type) {
        return findExtension(type).orElseThrow(() -> ResourceNotFoundException.extension(type.typeName()));
    }

    public Optional<ApiExtension> findExtension(ExtensionType type) {
        return extensions.stream().filter(e -> e.type() == type).findFirst();
    }

    /**
     * Schema hrefs of the extensions that declare one, in registration order.
     */
    public List<String> schemaHrefs() {
        return extensions.stream()
                .map(ApiExtension::schemaHref)
                .flatMap(Optional::stream)
                .toList();
    }
}
