package com.phillippitts.champ.service.ensemble;

import com.phillippitts.champ.domain.RoundContext;
import com.phillippitts.champ.domain.RoundRecord;
import com.phillippitts.champ.domain.RoundResult;
import com.phillippitts.champ.util.LogSanitizer;
import com.phillippitts.champ.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans one prompt out to every configured {@link ModelClient} in parallel and collects exactly one
 * {@link RoundResult} per client.
 *
 * <p><b>Round:</b>
 * <ol>
 *   <li>Build the prompt from the {@link RoundContext} and derive a round id from the current time and
 *       the prompt hash.</li>
 *   <li>Submit one call per client to the dispatch executor.</li>
 *   <li>Wait for all calls, bounded by {@link Settings#roundTimeout()}. Calls still pending at the
 *       deadline are cancelled best-effort and recorded as timeouts.</li>
 *   <li>Classify each call: answer, failure (with its description) or timeout.</li>
 *   <li>Append the {@link RoundRecord} to a FIFO history bounded by {@link Settings#historyCapacity()}.</li>
 * </ol>
 *
 * <p><b>Ordering:</b> results follow the configured client order regardless of completion order.
 *
 * <p><b>Error Handling:</b> no endpoint failure or timeout escapes {@link #executeRound}; the round
 * always completes.
 *
 * <p><b>Thread Model:</b> the dispatch executor should not run tasks on the caller thread (e.g.
 * via a caller-runs rejection policy with a full queue), or a slow endpoint can hold the round
 * past its deadline.
 */
public class EnsembleOrchestrator {

    private static final Logger LOG = LogManager.getLogger(EnsembleOrchestrator.class);
    private static final int PREVIEW_CHARS = 80;

    /**
     * @param roundTimeout    overall deadline for one round
     * @param historyCapacity rounds retained in memory (oldest evicted first)
     */
    public record Settings(Duration roundTimeout, int historyCapacity) {
        public Settings {
            Objects.requireNonNull(roundTimeout, "roundTimeout");
            if (historyCapacity <= 0) {
                throw new IllegalArgumentException("historyCapacity must be positive, got: " + historyCapacity);
            }
        }
    }

    private final List<ModelClient> clients;
    private final Executor executor;
    private final Settings settings;
    private final Clock clock;
    private final Deque<RoundRecord> history = new ArrayDeque<>();

    public EnsembleOrchestrator(List<ModelClient> clients, Executor executor, Settings settings, Clock clock) {
        this.clients = List.copyOf(Objects.requireNonNull(clients, "clients"));
        this.executor = Objects.requireNonNull(executor, "executor");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Executes one dispatch round.
     *
     * @param context observations the prompt is built from
     * @return the round record; {@code results()} holds one entry per client in configured order
     */
    public RoundRecord executeRound(RoundContext context) {
        Objects.requireNonNull(context, "context");
        String prompt = PromptTemplate.build(context);
        String roundId = roundId(prompt);
        long start = System.nanoTime();
        LOG.info("Round {} dispatching to {} endpoint(s): symbol={}", roundId, clients.size(), context.symbol());

        List<CompletableFuture<ModelResponse>> futures = new ArrayList<>(clients.size());
        for (ModelClient client : clients) {
            futures.add(CompletableFuture.supplyAsync(() -> client.generate(prompt, roundId), executor));
        }
        awaitAll(futures, roundId);

        List<RoundResult> results = new ArrayList<>(clients.size());
        for (int i = 0; i < clients.size(); i++) {
            results.add(classify(clients.get(i).getName(), futures.get(i)));
        }

        RoundRecord record = new RoundRecord(roundId, context.timestamp(), context, results);
        remember(record);
        LOG.info("Round {} complete: {}/{} succeeded in {} ms",
                roundId, record.successCount(), results.size(), Math.round(TimeUtils.elapsedMillis(start)));
        return record;
    }

    /**
     * @return aggregate counters across every client's lifetime
     */
    public EnsemblePerformance getPerformanceMetrics() {
        long successful = 0;
        long total = 0;
        long errors = 0;
        double latencySum = 0.0;
        int latencyCount = 0;
        int active = 0;
        for (ModelClient client : clients) {
            EndpointStats stats = client.getStats();
            successful += stats.successfulCalls();
            total += stats.totalCalls();
            errors += stats.errorCount();
            if (stats.avgLatencyMs() != 0.0) {
                latencySum += stats.avgLatencyMs();
                latencyCount++;
            }
            if (client.isHealthy()) {
                active++;
            }
        }
        double successRate = total == 0 ? 1.0 : (double) successful / total;
        double avgLatency = latencyCount == 0 ? 0.0 : latencySum / latencyCount;
        return new EnsemblePerformance(active, historySize(), successRate, avgLatency, errors);
    }

    /**
     * @return a copy of the retained rounds, oldest first
     */
    public synchronized List<RoundRecord> getRoundHistory() {
        return List.copyOf(history);
    }

    public synchronized int historySize() {
        return history.size();
    }

    public List<ModelClient> getClients() {
        return clients;
    }

    private String roundId(String prompt) {
        return String.format(Locale.ROOT, "round_%d_%04d",
                clock.instant().getEpochSecond(), Math.floorMod(prompt.hashCode(), 10_000));
    }

    private void awaitAll(List<CompletableFuture<ModelResponse>> futures, String roundId) {
        long timeoutMs = settings.roundTimeout().toMillis();
        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            long pending = futures.stream().filter(f -> !f.isDone()).count();
            LOG.warn("Round {} timed out after {} ms; {} endpoint(s) still pending", roundId, timeoutMs, pending);
            futures.forEach(f -> f.cancel(true));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.warn("Round {} interrupted while waiting for endpoints", roundId);
            futures.forEach(f -> f.cancel(true));
        } catch (ExecutionException ee) {
            LOG.debug("Round {} has failed endpoint(s); classifying individually", roundId);
        }
    }

    private RoundResult classify(String endpointName, CompletableFuture<ModelResponse> future) {
        if (!future.isDone() || future.isCancelled()) {
            return RoundResult.timeout(endpointName);
        }
        try {
            ModelResponse response = future.join();
            LOG.debug("Endpoint {} answered: {}", endpointName, LogSanitizer.truncate(response.text(), PREVIEW_CHARS));
            return RoundResult.success(endpointName, response.text(), response.latencyMs());
        } catch (CompletionException ce) {
            Throwable cause = ce.getCause() != null ? ce.getCause() : ce;
            LOG.warn("Endpoint {} failed: {}", endpointName, cause.getMessage());
            return RoundResult.failure(endpointName, cause);
        }
    }

    private synchronized void remember(RoundRecord record) {
        history.addLast(record);
        while (history.size() > settings.historyCapacity()) {
            history.removeFirst();
        }
    }
}
