package stac.core.service.common;

import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;

import stac.core.model.common.ResourceConflictException;
import stac.core.model.common.ResourceNotFoundException;
import stac.core.port.out.BackendMetrics;

/**
 * Wraps calls into the backend so each one is timed and its outcome recorded.
 */
public final class BackendCalls {

    private BackendCalls() {}

    public static <T> Uni<T> observe(BackendMetrics metrics, String operation, Supplier<Uni<T>> call) {
        return Uni.createFrom().deferred(() -> {
            long start = System.nanoTime();
            return call.get().onItemOrFailure().invoke((item, failure) -> {
                long durationMs = (System.nanoTime() - start) / 1_000_000;
                metrics.recordBackendCall(operation, outcome(failure), durationMs);
            });
        });
    }

    static String outcome(Throwable failure) {
        if (failure == null) {
            return "success";
        }
        if (failure instanceof ResourceNotFoundException) {
            return "not_found";
        }
        if (failure instanceof ResourceConflictException) {
            return "conflict";
        }
        return "error";
    }
}
