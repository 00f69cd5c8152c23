package stac.core.model.extension;

import java.util.List;

/**
 * Transaction extension: create, replace and delete of items and collections.
 *
 * <p>Contributes routes only; no search fields.
 */
public final class TransactionExtension implements ApiExtension {

    private final List<String> conformanceClasses;

    public TransactionExtension() {
        this(List.of(ConformanceClasses.TRANSACTION, ConformanceClasses.SIMPLE_TRANSACTION));
    }

    public TransactionExtension(List<String> conformanceClasses) {
        this.conformanceClasses = List.copyOf(conformanceClasses);
    }

    @Override
    public ExtensionType type() {
        return ExtensionType.TRANSACTION;
    }

    @Override
    public List<String> conformanceClasses() {
        return conformanceClasses;
    }
}
