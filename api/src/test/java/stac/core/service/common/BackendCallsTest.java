package stac.core.service.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.smallrye.mutiny.Uni;

import stac.core.model.common.ResourceConflictException;
import stac.core.model.common.ResourceNotFoundException;
import stac.core.port.out.BackendMetrics;

@DisplayName("BackendCalls")
class BackendCallsTest {

    @Test
    @DisplayName("Should map failures to outcomes")
    void shouldMapOutcomes() {
        assertEquals("success", BackendCalls.outcome(null));
        assertEquals("not_found", BackendCalls.outcome(ResourceNotFoundException.collection("c")));
        assertEquals("conflict", BackendCalls.outcome(new ResourceConflictException("Collection", "c")));
        assertEquals("error", BackendCalls.outcome(new IllegalStateException()));
    }

    @Test
    @DisplayName("Should record nothing until subscribed")
    void shouldDeferUntilSubscribed() {
        var metrics = mock(BackendMetrics.class);

        var call = BackendCalls.observe(metrics, "getItem", () -> Uni.createFrom().item("x"));

        verify(metrics, never()).recordBackendCall(eq("getItem"), eq("success"), anyLong());
        assertEquals("x", call.await().indefinitely());
        verify(metrics).recordBackendCall(eq("getItem"), eq("success"), anyLong());
    }

    @Test
    @DisplayName("Should record failures and propagate them")
    void shouldRecordFailures() {
        var metrics = mock(BackendMetrics.class);

        var call = BackendCalls.<String>observe(
                metrics, "getItem", () -> Uni.createFrom().failure(ResourceNotFoundException.item("c", "i")));

        assertThrows(ResourceNotFoundException.class, () -> call.await().indefinitely());
        verify(metrics).recordBackendCall(eq("getItem"), eq("not_found"), anyLong());
    }
}
