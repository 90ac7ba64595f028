package com.phillippitts.champ.service.health;

import com.phillippitts.champ.service.stream.StreamHealthSnapshot;
import com.phillippitts.champ.service.stream.StreamManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the trade stream.
 *
 * <ul>
 *   <li>UP: breaker closed</li>
 *   <li>DEGRADED: breaker half-open (probing after a cooldown)</li>
 *   <li>DOWN: breaker open</li>
 * </ul>
 *
 * <p>Details carry the full health snapshot. Exposed via /actuator/health.
 */
@Component
public class StreamHealthIndicator implements HealthIndicator {

    private final StreamManager streamManager;

    public StreamHealthIndicator(StreamManager streamManager) {
        this.streamManager = streamManager;
    }

    @Override
    public Health health() {
        StreamHealthSnapshot snapshot = streamManager.getHealthSnapshot();
        Health.Builder builder = switch (snapshot.circuitState()) {
            case CLOSED -> Health.up();
            case HALF_OPEN -> Health.status("DEGRADED");
            case OPEN -> Health.down();
        };
        return builder
                .withDetail("stream", streamManager.getName())
                .withDetail("running", streamManager.isRunning())
                .withDetails(snapshot.toMap())
                .build();
    }
}
