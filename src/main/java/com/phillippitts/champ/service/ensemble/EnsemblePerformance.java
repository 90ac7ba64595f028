package com.phillippitts.champ.service.ensemble;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate view over every client's lifetime counters.
 *
 * @param activeClients clients currently reporting healthy
 * @param totalRounds   rounds held in the in-memory history
 * @param successRate   successful / total attempts across clients (1.0 before any call)
 * @param avgLatencyMs  mean of each client's non-zero running average latency
 * @param totalErrors   failed attempts across clients
 */
public record EnsemblePerformance(
        int activeClients,
        int totalRounds,
        double successRate,
        double avgLatencyMs,
        long totalErrors
) {
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("active_clients", activeClients);
        map.put("total_rounds", totalRounds);
        map.put("success_rate", successRate);
        map.put("avg_latency", avgLatencyMs);
        map.put("total_errors", totalErrors);
        return map;
    }
}
