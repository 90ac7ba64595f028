package com.phillippitts.champ.service.stream;

import com.phillippitts.champ.service.resilience.CircuitState;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only copy of a stream's health counters.
 *
 * @param messageCount    messages received since startup
 * @param errorCount      connection and handler failures since startup
 * @param reconnectCount  successful connection opens since startup
 * @param lastMessageTime time of the most recent message, null if none yet
 * @param currentDowntime time since the last message beyond the grace period (zero while fresh)
 * @param totalDowntime   cumulative downtime including the current gap
 * @param circuitState    state of the stream's circuit breaker when the snapshot was taken
 */
public record StreamHealthSnapshot(
        long messageCount,
        long errorCount,
        long reconnectCount,
        Instant lastMessageTime,
        Duration currentDowntime,
        Duration totalDowntime,
        CircuitState circuitState
) {

    /**
     * Flattens the snapshot into the key-value form polled by metrics and status collaborators.
     * Downtimes are reported in seconds.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("message_count", messageCount);
        map.put("error_count", errorCount);
        map.put("reconnect_count", reconnectCount);
        map.put("current_downtime", currentDowntime.toMillis() / 1000.0);
        map.put("total_downtime", totalDowntime.toMillis() / 1000.0);
        map.put("circuit_breaker_state", circuitState.name());
        map.put("last_message_time", lastMessageTime == null ? null : lastMessageTime.toString());
        return map;
    }
}
