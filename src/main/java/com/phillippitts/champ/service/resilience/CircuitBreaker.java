package com.phillippitts.champ.service.resilience;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Tri-state failure gate protecting one external resource from repeated futile calls.
 *
 * <p>State transitions:
 * <ul>
 *   <li>CLOSED: every call allowed; {@code maxFailures} consecutive failures open the circuit</li>
 *   <li>OPEN: calls refused until {@code timeout} has elapsed since the last failure, at which point
 *       the next {@link #canExecute()} moves to HALF_OPEN and lets that caller through</li>
 *   <li>HALF_OPEN: calls allowed; a success closes the circuit, a failure reopens it</li>
 * </ul>
 *
 * <p>There is no background timer: the cooldown is evaluated lazily against the injected
 * {@link Clock} on each {@link #canExecute()} call. All methods are synchronized on the instance.
 */
public class CircuitBreaker {

    private static final Logger LOG = LogManager.getLogger(CircuitBreaker.class);

    private final String name;
    private final int maxFailures;
    private final Duration timeout;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int failures;
    private Instant lastFailure;

    public CircuitBreaker(String name, int maxFailures, Duration timeout, Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        if (maxFailures <= 0) {
            throw new IllegalArgumentException("maxFailures must be positive, got: " + maxFailures);
        }
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
        this.maxFailures = maxFailures;
        this.timeout = timeout;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CircuitBreaker(String name, int maxFailures, Duration timeout) {
        this(name, maxFailures, timeout, Clock.systemUTC());
    }

    /**
     * Decides whether the caller may attempt the protected operation now.
     *
     * @return false only while OPEN and the cooldown has not yet elapsed
     */
    public synchronized boolean canExecute() {
        if (state != CircuitState.OPEN) {
            return true;
        }
        if (Duration.between(lastFailure, clock.instant()).compareTo(timeout) > 0) {
            state = CircuitState.HALF_OPEN;
            LOG.info("Circuit {} half-open after {} cooldown; allowing probe", name, timeout);
            return true;
        }
        return false;
    }

    public synchronized void onSuccess() {
        if (state != CircuitState.CLOSED) {
            LOG.info("Circuit {} closed after successful call", name);
        }
        state = CircuitState.CLOSED;
        failures = 0;
    }

    public synchronized void onFailure() {
        failures++;
        lastFailure = clock.instant();
        if (state == CircuitState.HALF_OPEN) {
            state = CircuitState.OPEN;
            LOG.warn("Circuit {} reopened: probe failed", name);
        } else if (state == CircuitState.CLOSED && failures >= maxFailures) {
            state = CircuitState.OPEN;
            LOG.warn("Circuit {} opened after {} failures; cooldown {}", name, failures, timeout);
        }
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failures;
    }

    public String getName() {
        return name;
    }
}
