package com.phillippitts.champ.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe facade over {@link EnsembleMetrics} used by clients, the dispatcher and the scheduler.
 *
 * <p>{@link #NOOP} lets those components run without a meter registry in tests.
 */
@Component
public final class EnsembleMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(EnsembleMetricsPublisher.class);

    public static final EnsembleMetricsPublisher NOOP = new EnsembleMetricsPublisher(null);

    private final EnsembleMetrics metrics;

    /**
     * @param metrics metrics tracking service (nullable for test mode)
     */
    public EnsembleMetricsPublisher(EnsembleMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("EnsembleMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordSuccess(String endpointName, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(endpointName, durationNanos);
        metrics.incrementSuccess(endpointName);
    }

    public void recordFailure(String endpointName, Throwable error) {
        if (metrics == null) {
            return;
        }
        Throwable root = error.getCause() != null ? error.getCause() : error;
        metrics.incrementFailure(endpointName, root.getClass().getSimpleName());
    }

    public void recordRound(String outcome) {
        if (metrics == null) {
            return;
        }
        metrics.recordRound(outcome);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
