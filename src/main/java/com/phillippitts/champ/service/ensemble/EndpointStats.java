package com.phillippitts.champ.service.ensemble;

/**
 * Copy of one client's rolling counters.
 *
 * @param totalCalls      attempts, including retries
 * @param successfulCalls attempts that returned an answer
 * @param errorCount      attempts that failed
 * @param avgLatencyMs    running mean latency over successful attempts (0 until the first success)
 */
public record EndpointStats(long totalCalls, long successfulCalls, long errorCount, double avgLatencyMs) {

    public static final EndpointStats EMPTY = new EndpointStats(0, 0, 0, 0.0);
}
