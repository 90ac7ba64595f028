package com.phillippitts.champ.service.ensemble;

import com.phillippitts.champ.exception.EndpointException;
import com.phillippitts.champ.service.metrics.EnsembleMetricsPublisher;
import com.phillippitts.champ.util.Sleeper;
import com.phillippitts.champ.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.util.Objects;

/**
 * {@link ModelClient} that retries failed attempts with multiplicative backoff.
 *
 * <p><b>Retry:</b> every attempt increments {@code totalCalls}. A failed attempt increments
 * {@code errorCount}; while fewer than {@link RetryPolicy#maxRetries()} retries have been made the
 * client sleeps the current backoff (initially {@link RetryPolicy#retryBackoff()} seconds), multiplies
 * it by {@code retryBackoff} and tries again. After the last retry the failure propagates as an
 * {@link EndpointException}.
 *
 * <p><b>Latency:</b> on success the running mean over successful attempts is updated:
 * {@code avg = (avg * (successful - 1) + latest) / successful}.
 *
 * <p><b>Health:</b> {@link #isHealthy()} is a plain threshold on the lifetime error count; it does not
 * gate calls.
 *
 * <p>Counters are guarded by the instance lock, which is never held across I/O or sleeps.
 */
public class RetryingModelClient implements ModelClient {

    private static final Logger LOG = LogManager.getLogger(RetryingModelClient.class);

    /**
     * @param maxRetries           retries after the first attempt
     * @param retryBackoff         initial backoff in seconds and the multiplier applied after each retry
     * @param healthyErrorThreshold error count at which the client reports unhealthy
     */
    public record RetryPolicy(int maxRetries, double retryBackoff, int healthyErrorThreshold) {
        public RetryPolicy {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
            }
            if (retryBackoff < 0) {
                throw new IllegalArgumentException("retryBackoff must be >= 0, got: " + retryBackoff);
            }
            if (healthyErrorThreshold <= 0) {
                throw new IllegalArgumentException("healthyErrorThreshold must be positive, got: " + healthyErrorThreshold);
            }
        }
    }

    private final String name;
    private final URI endpoint;
    private final ModelTransport transport;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final EnsembleMetricsPublisher metrics;

    private long totalCalls;
    private long successfulCalls;
    private long errorCount;
    private double avgLatencyMs;

    public RetryingModelClient(String name,
                               URI endpoint,
                               ModelTransport transport,
                               RetryPolicy policy,
                               Sleeper sleeper,
                               EnsembleMetricsPublisher metrics) {
        this.name = Objects.requireNonNull(name, "name");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.metrics = metrics == null ? EnsembleMetricsPublisher.NOOP : metrics;
    }

    @Override
    public String getName() {
        return name;
    }

    public URI getEndpoint() {
        return endpoint;
    }

    @Override
    public ModelResponse generate(String prompt, String roundId) {
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(roundId, "roundId");
        int retries = 0;
        double backoffSeconds = policy.retryBackoff();
        while (true) {
            recordAttempt();
            long start = System.nanoTime();
            try {
                String text = transport.generate(endpoint, prompt, roundId);
                long elapsedNanos = System.nanoTime() - start;
                double latencyMs = TimeUtils.nanosToMillis(elapsedNanos);
                recordSuccess(latencyMs);
                metrics.recordSuccess(name, elapsedNanos);
                LOG.debug("Endpoint {} answered round {} in {} ms", name, roundId, latencyMs);
                return new ModelResponse(text, latencyMs);
            } catch (RuntimeException e) {
                recordError();
                metrics.recordFailure(name, e);
                if (retries >= policy.maxRetries()) {
                    LOG.warn("Endpoint {} failed round {} after {} attempt(s): {}", name, roundId, retries + 1, e.getMessage());
                    throw new EndpointException("Retries exhausted after " + (retries + 1) + " attempt(s): "
                            + e.getMessage(), name, e);
                }
                retries++;
                LOG.info("Endpoint {} attempt {} failed: {}; retrying in {}s", name, retries, e.getMessage(), backoffSeconds);
                pause(backoffSeconds);
                backoffSeconds *= policy.retryBackoff();
            }
        }
    }

    @Override
    public synchronized EndpointStats getStats() {
        return new EndpointStats(totalCalls, successfulCalls, errorCount, avgLatencyMs);
    }

    @Override
    public synchronized boolean isHealthy() {
        return errorCount < policy.healthyErrorThreshold();
    }

    private void pause(double seconds) {
        try {
            sleeper.sleep(TimeUtils.ofSeconds(seconds));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new EndpointException("Interrupted during retry backoff", name, ie);
        }
    }

    private synchronized void recordAttempt() {
        totalCalls++;
    }

    private synchronized void recordSuccess(double latencyMs) {
        successfulCalls++;
        avgLatencyMs = (avgLatencyMs * (successfulCalls - 1) + latencyMs) / successfulCalls;
    }

    private synchronized void recordError() {
        errorCount++;
    }
}
