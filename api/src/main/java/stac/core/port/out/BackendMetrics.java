package stac.core.port.out;

/**
 * Port for recording backend call metrics.
 */
public interface BackendMetrics {

    /**
     * Record one call into the backend.
     *
     * @param operation  client operation, e.g. {@code getSearch}
     * @param outcome    {@code success}, {@code not_found}, {@code conflict} or {@code error}
     * @param durationMs duration in milliseconds
     */
    void recordBackendCall(String operation, String outcome, long durationMs);

    /**
     * Record a request rejected during parameter binding.
     *
     * @param model name of the request model
     */
    void recordValidationFailure(String model);
}
