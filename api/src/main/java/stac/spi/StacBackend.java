package stac.spi;

import java.util.Optional;

/**
 * The client set one backend supplies, normalized to the non-blocking contracts.
 *
 * <p>A backend is either entirely blocking or entirely non-blocking. Blocking clients are wrapped
 * so their calls run on the worker pool. A missing filters client falls back to the default
 * queryables; a missing transactions client leaves the transaction routes disabled.
 */
public final class StacBackend {

    /** Which client family the backend was built from. */
    public enum Family {
        BLOCKING,
        ASYNC
    }

    private final Family family;
    private final AsyncCoreClient core;
    private final AsyncTransactionsClient transactions;
    private final AsyncFiltersClient filters;

    private StacBackend(
            Family family, AsyncCoreClient core, AsyncTransactionsClient transactions, AsyncFiltersClient filters) {
        if (core == null) {
            throw new StacBackendException("A STAC backend requires a core client");
        }
        this.family = family;
        this.core = core;
        this.transactions = transactions;
        this.filters = filters != null ? filters : new AsyncFiltersClient() {};
    }

    /**
     * Build a backend from blocking clients.
     *
     * @param core         the core client, required
     * @param transactions the transactions client, or null
     * @param filters      the filters client, or null
     * @return the backend
     */
    public static StacBackend blocking(CoreClient core, TransactionsClient transactions, FiltersClient filters) {
        if (core == null) {
            throw new StacBackendException("A STAC backend requires a core client");
        }
        return new StacBackend(
                Family.BLOCKING,
                new BlockingClientAdapters.Core(core),
                transactions != null ? new BlockingClientAdapters.Transactions(transactions) : null,
                filters != null ? new BlockingClientAdapters.Filters(filters) : null);
    }

    /**
     * Build a backend from non-blocking clients.
     *
     * @param core         the core client, required
     * @param transactions the transactions client, or null
     * @param filters      the filters client, or null
     * @return the backend
     */
    public static StacBackend async(
            AsyncCoreClient core, AsyncTransactionsClient transactions, AsyncFiltersClient filters) {
        return new StacBackend(Family.ASYNC, core, transactions, filters);
    }

    public Family family() {
        return family;
    }

    public AsyncCoreClient core() {
        return core;
    }

    public Optional<AsyncTransactionsClient> transactions() {
        return Optional.ofNullable(transactions);
    }

    public AsyncFiltersClient filters() {
        return filters;
    }
}
