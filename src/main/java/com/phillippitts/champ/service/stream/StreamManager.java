package com.phillippitts.champ.service.stream;

import com.phillippitts.champ.service.resilience.CircuitBreaker;
import com.phillippitts.champ.service.resilience.CircuitState;
import com.phillippitts.champ.service.stream.event.CircuitOpenedEvent;
import com.phillippitts.champ.util.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Keeps one inbound stream connected for as long as the manager is running.
 *
 * <p><b>Loop:</b> while running, the manager asks its {@link CircuitBreaker} for permission. When
 * refused it waits {@link Settings#breakerWait()} and asks again. Otherwise it opens a session,
 * resets the backoff and counts the connect, then hands each message to the {@link MessageHandler}.
 * <ul>
 *   <li>Handler success notifies the breaker of success.</li>
 *   <li>Handler failure counts an error, notifies the breaker and drops the session to reconnect.</li>
 *   <li>Open/read failure counts an error, notifies the breaker, sleeps the current backoff and doubles
 *       it up to {@link Settings#maxBackoff()}.</li>
 *   <li>A normal remote close reconnects immediately.</li>
 * </ul>
 *
 * <p><b>Stop:</b> {@link #stop()} is observed after every message and every connection attempt; an
 * in-flight handler call is never cancelled. Interrupting the loop thread also stops it.
 *
 * <p><b>Thread Model:</b> {@link #run} blocks the calling thread and must be invoked from a single
 * dedicated thread. {@link #getHealthSnapshot()} is safe from any thread.
 */
public class StreamManager {

    private static final Logger LOG = LogManager.getLogger(StreamManager.class);

    /**
     * Reconnect timing.
     *
     * @param initialBackoff first wait after a connection failure (floor after each successful open)
     * @param maxBackoff     ceiling for the doubling backoff
     * @param breakerWait    re-check interval while the breaker refuses execution
     * @param downtimeGrace  message silence tolerated before it counts as downtime
     */
    public record Settings(Duration initialBackoff, Duration maxBackoff, Duration breakerWait, Duration downtimeGrace) {
        public Settings {
            Objects.requireNonNull(initialBackoff, "initialBackoff");
            Objects.requireNonNull(maxBackoff, "maxBackoff");
            Objects.requireNonNull(breakerWait, "breakerWait");
            Objects.requireNonNull(downtimeGrace, "downtimeGrace");
            requirePositive(initialBackoff, "initialBackoff");
            requirePositive(maxBackoff, "maxBackoff");
            requirePositive(breakerWait, "breakerWait");
        }

        private static void requirePositive(Duration value, String name) {
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive, got: " + value);
            }
        }

        public static Settings defaults() {
            return new Settings(Duration.ofSeconds(1), Duration.ofSeconds(32),
                    Duration.ofSeconds(5), Duration.ofSeconds(30));
        }
    }

    private final String name;
    private final StreamConnector connector;
    private final CircuitBreaker circuitBreaker;
    private final Settings settings;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;
    private final ConnectionHealth health = new ConnectionHealth();

    private volatile boolean running;

    /**
     * @param name           stream name used in logs and events
     * @param connector      transport used to open sessions
     * @param circuitBreaker breaker gating connection attempts
     * @param settings       backoff and grace timings
     * @param sleeper        pause implementation (real sleep in production)
     * @param clock          time source for message stamps and downtime
     * @param publisher      receives {@link CircuitOpenedEvent}s (nullable for test mode)
     */
    public StreamManager(String name,
                         StreamConnector connector,
                         CircuitBreaker circuitBreaker,
                         Settings settings,
                         Sleeper sleeper,
                         Clock clock,
                         ApplicationEventPublisher publisher) {
        this.name = Objects.requireNonNull(name, "name");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.publisher = publisher;
    }

    public void start() {
        running = true;
    }

    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    public String getName() {
        return name;
    }

    /**
     * Runs the connect/read loop until {@link #stop()} is called or the thread is interrupted.
     * Never throws for transport or handler failures.
     *
     * @param uri     stream endpoint
     * @param handler receives each inbound message
     */
    public void run(URI uri, MessageHandler handler) {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(handler, "handler");
        LOG.info("Stream {} loop starting: url={}", name, uri);
        Duration backoff = settings.initialBackoff();
        try {
            while (running) {
                if (!circuitBreaker.canExecute()) {
                    LOG.debug("Stream {} circuit {}; waiting {}", name, circuitBreaker.getState(), settings.breakerWait());
                    sleeper.sleep(settings.breakerWait());
                    continue;
                }
                try (StreamSession session = connector.open(uri)) {
                    health.recordConnected();
                    backoff = settings.initialBackoff();
                    LOG.info("Stream {} connected", name);
                    readUntilClosed(session, handler);
                } catch (IOException | RuntimeException e) {
                    health.recordError();
                    recordBreakerFailure(e);
                    LOG.warn("Stream {} connection failed: {}; reconnecting in {}", name, e.getMessage(), backoff);
                    sleeper.sleep(backoff);
                    backoff = nextBackoff(backoff);
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            running = false;
            LOG.info("Stream {} loop interrupted", name);
        }
        LOG.info("Stream {} loop stopped", name);
    }

    /**
     * Returns a copy of the health counters with the current downtime freshly computed.
     */
    public StreamHealthSnapshot getHealthSnapshot() {
        return health.snapshot(clock.instant(), settings.downtimeGrace(), circuitBreaker.getState());
    }

    private void readUntilClosed(StreamSession session, MessageHandler handler)
            throws IOException, InterruptedException {
        while (running) {
            String message = session.nextMessage();
            if (message == null) {
                LOG.info("Stream {} closed by remote", name);
                return;
            }
            health.recordMessage(clock.instant(), settings.downtimeGrace());
            try {
                handler.onMessage(message);
                circuitBreaker.onSuccess();
            } catch (InterruptedException ie) {
                throw ie;
            } catch (Exception e) {
                health.recordError();
                recordBreakerFailure(e);
                LOG.warn("Stream {} handler failed: {}; reconnecting", name, e.toString());
                return;
            }
        }
    }

    private void recordBreakerFailure(Exception cause) {
        CircuitState before = circuitBreaker.getState();
        circuitBreaker.onFailure();
        if (before != CircuitState.OPEN && circuitBreaker.getState() == CircuitState.OPEN && publisher != null) {
            try {
                publisher.publishEvent(new CircuitOpenedEvent(
                        name, clock.instant(), circuitBreaker.getFailureCount(), cause.getMessage()));
            } catch (RuntimeException e) {
                LOG.warn("Stream {} circuit-open listener failed: {}", name, e.toString());
            }
        }
    }

    private Duration nextBackoff(Duration current) {
        Duration doubled = current.multipliedBy(2);
        return doubled.compareTo(settings.maxBackoff()) > 0 ? settings.maxBackoff() : doubled;
    }
}
