package stac.adapter.out.telemetry;

import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import stac.core.port.out.BackendMetrics;

/**
 * Micrometer implementation of {@link BackendMetrics}.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code stac.backend.calls} - Backend calls by operation and outcome</li>
 *   <li>{@code stac.backend.duration} - Backend call latency</li>
 *   <li>{@code stac.request.validation.failures} - Requests rejected while binding parameters</li>
 * </ul>
 */
@ApplicationScoped
public class StacBackendMetrics implements BackendMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public StacBackendMetrics(
            MeterRegistry registry,
            @ConfigProperty(name = "stac.telemetry.metrics.enabled", defaultValue = "true") boolean enabled) {
        this.registry = registry;
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordBackendCall(String operation, String outcome, long durationMs) {
        if (!enabled) {
            return;
        }

        Counter.builder("stac.backend.calls")
                .description("Calls into the STAC backend")
                .tag("operation", nullSafe(operation))
                .tag("outcome", nullSafe(outcome))
                .register(registry)
                .increment();

        Timer.builder("stac.backend.duration")
                .description("STAC backend call latency")
                .tag("operation", nullSafe(operation))
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordValidationFailure(String model) {
        if (!enabled) {
            return;
        }

        Counter.builder("stac.request.validation.failures")
                .description("Requests rejected during parameter binding")
                .tag("model", nullSafe(model))
                .register(registry)
                .increment();
    }

    private String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
