package com.phillippitts.champ.service.stream.event;

import java.time.Instant;

/**
 * Published when a stream's circuit breaker transitions to OPEN.
 *
 * @param resource      name of the protected resource (stream name)
 * @param at            when the transition happened
 * @param failureCount  consecutive failures recorded by the breaker
 * @param lastError     message of the failure that opened the circuit (may be null)
 */
public record CircuitOpenedEvent(String resource, Instant at, int failureCount, String lastError) {
    public CircuitOpenedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
