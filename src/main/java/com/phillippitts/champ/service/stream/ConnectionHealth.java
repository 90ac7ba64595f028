package com.phillippitts.champ.service.stream;

import com.phillippitts.champ.service.resilience.CircuitState;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Health counters for one stream connection.
 *
 * <p>Single writer (the read loop of the owning {@link StreamManager}); any thread may take a
 * {@link #snapshot} which copies the current values and never mutates them.
 */
final class ConnectionHealth {

    private final AtomicLong messageCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();
    private final AtomicLong reconnectCount = new AtomicLong();
    private volatile Instant lastMessageTime;
    private volatile Duration closedDowntime = Duration.ZERO;

    void recordMessage(Instant now, Duration grace) {
        Instant previous = lastMessageTime;
        if (previous != null) {
            Duration gap = Duration.between(previous, now).minus(grace);
            if (gap.compareTo(Duration.ZERO) > 0) {
                closedDowntime = closedDowntime.plus(gap);
            }
        }
        lastMessageTime = now;
        messageCount.incrementAndGet();
    }

    void recordError() {
        errorCount.incrementAndGet();
    }

    void recordConnected() {
        reconnectCount.incrementAndGet();
    }

    StreamHealthSnapshot snapshot(Instant now, Duration grace, CircuitState circuitState) {
        Instant last = lastMessageTime;
        Duration current = Duration.ZERO;
        if (last != null) {
            Duration sinceLast = Duration.between(last, now).minus(grace);
            if (sinceLast.compareTo(Duration.ZERO) > 0) {
                current = sinceLast;
            }
        }
        return new StreamHealthSnapshot(
                messageCount.get(),
                errorCount.get(),
                reconnectCount.get(),
                last,
                current,
                closedDowntime.plus(current),
                circuitState
        );
    }
}
