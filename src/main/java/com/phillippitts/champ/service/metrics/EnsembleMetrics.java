package com.phillippitts.champ.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for model endpoint calls and dispatch rounds.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Call latency per endpoint</li>
 *   <li>Success/failure counts per endpoint, failures tagged with a reason</li>
 *   <li>Round outcomes (logged, skipped, ledger failure)</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class EnsembleMetrics {

    private static final String METRIC_PREFIX = "champ";

    private final MeterRegistry registry;

    public EnsembleMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the latency of one successful endpoint attempt.
     *
     * @param endpointName configured endpoint name
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String endpointName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".model.latency")
                .description("Time taken by a model endpoint to answer")
                .tag("model", endpointName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String endpointName) {
        Counter.builder(METRIC_PREFIX + ".model.calls")
                .description("Model endpoint call attempts")
                .tag("model", endpointName)
                .tag("status", "success")
                .tag("reason", "none")
                .register(registry)
                .increment();
    }

    /**
     * @param endpointName configured endpoint name
     * @param reason failure category (exception type of the root failure)
     */
    public void incrementFailure(String endpointName, String reason) {
        Counter.builder(METRIC_PREFIX + ".model.calls")
                .description("Model endpoint call attempts")
                .tag("model", endpointName)
                .tag("status", "error")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome round outcome (logged, skipped, ledger_failure)
     */
    public void recordRound(String outcome) {
        Counter.builder(METRIC_PREFIX + ".rounds")
                .description("Dispatch rounds by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
