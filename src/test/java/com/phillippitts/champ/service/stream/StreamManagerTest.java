package com.phillippitts.champ.service.stream;

import com.phillippitts.champ.service.resilience.CircuitBreaker;
import com.phillippitts.champ.service.resilience.CircuitState;
import com.phillippitts.champ.service.stream.event.CircuitOpenedEvent;
import com.phillippitts.champ.testutil.EventCapturingPublisher;
import com.phillippitts.champ.testutil.MutableClock;
import com.phillippitts.champ.testutil.RecordingSleeper;
import com.phillippitts.champ.testutil.ScriptedStreamConnector;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamManagerTest {

    private static final URI FEED = URI.create("wss://example.test/ws/btcusdt@trade");

    private final MutableClock clock = MutableClock.atEpochSecond(1_700_000_000L);
    private final RecordingSleeper sleeper = new RecordingSleeper(clock);
    private final ScriptedStreamConnector connector = new ScriptedStreamConnector();
    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final List<String> handled = new CopyOnWriteArrayList<>();

    private StreamManager manager(CircuitBreaker breaker) {
        StreamManager manager = new StreamManager("trade-feed", connector, breaker,
                StreamManager.Settings.defaults(), sleeper, clock, publisher);
        connector.onExhausted(manager::stop);
        manager.start();
        return manager;
    }

    private CircuitBreaker lenientBreaker() {
        return new CircuitBreaker("trade-feed", 100, Duration.ofSeconds(60), clock);
    }

    @Test
    void deliversEveryMessageAndReconnectsAfterNormalClose() {
        connector.session("a", "b").session("c");
        StreamManager manager = manager(lenientBreaker());

        manager.run(FEED, handled::add);

        assertThat(handled).containsExactly("a", "b", "c");
        StreamHealthSnapshot health = manager.getHealthSnapshot();
        assertThat(health.messageCount()).isEqualTo(3);
        assertThat(health.errorCount()).isZero();
        // two scripted sessions plus the exhausting open
        assertThat(health.reconnectCount()).isEqualTo(3);
        assertThat(sleeper.getSleeps()).isEmpty();
        assertThat(manager.isRunning()).isFalse();
    }

    @Test
    void backoffDoublesUpToCeiling() {
        for (int i = 0; i < 7; i++) {
            connector.failOpen("refused " + i);
        }
        StreamManager manager = manager(lenientBreaker());

        manager.run(FEED, handled::add);

        assertThat(sleeper.getSleeps()).containsExactly(
                Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8),
                Duration.ofSeconds(16), Duration.ofSeconds(32), Duration.ofSeconds(32));
        assertThat(manager.getHealthSnapshot().errorCount()).isEqualTo(7);
    }

    @Test
    void successfulOpenResetsBackoff() {
        connector.failOpen("refused").failOpen("refused").session().failOpen("refused");
        StreamManager manager = manager(lenientBreaker());

        manager.run(FEED, handled::add);

        assertThat(sleeper.getSleeps()).containsExactly(
                Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(1));
    }

    @Test
    void readErrorCountsAsConnectionFailure() {
        connector.sessionThenReadError("connection reset", "a");
        StreamManager manager = manager(lenientBreaker());

        manager.run(FEED, handled::add);

        assertThat(handled).containsExactly("a");
        assertThat(manager.getHealthSnapshot().errorCount()).isEqualTo(1);
        assertThat(sleeper.getSleeps()).containsExactly(Duration.ofSeconds(1));
        assertThat(connector.getClosedSessions()).isEqualTo(2);
    }

    @Test
    void handlerFailureDropsSessionAndReconnects() {
        connector.session("good", "bad", "never").session("after");
        CircuitBreaker breaker = lenientBreaker();
        StreamManager manager = manager(breaker);

        manager.run(FEED, message -> {
            handled.add(message);
            if (message.equals("bad")) {
                throw new IllegalStateException("unparseable");
            }
        });

        assertThat(handled).containsExactly("good", "bad", "after");
        StreamHealthSnapshot health = manager.getHealthSnapshot();
        assertThat(health.messageCount()).isEqualTo(3);
        assertThat(health.errorCount()).isEqualTo(1);
        assertThat(sleeper.getSleeps()).isEmpty();
        // the later success resets the breaker
        assertThat(breaker.getFailureCount()).isZero();
    }

    @Test
    void waitsWhileBreakerOpenAndPublishesEventOnce() {
        CircuitBreaker breaker = new CircuitBreaker("trade-feed", 2, Duration.ofSeconds(60), clock);
        connector.failOpen("refused").failOpen("refused").session("x");
        StreamManager manager = manager(breaker);

        manager.run(FEED, handled::add);

        assertThat(handled).containsExactly("x");
        assertThat(sleeper.getSleeps()).startsWith(Duration.ofSeconds(1), Duration.ofSeconds(2));
        // opened at t=1s, probes allowed once more than 60s have passed: t=3s + 12 * 5s
        assertThat(sleeper.count(Duration.ofSeconds(5))).isEqualTo(12);
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);

        List<CircuitOpenedEvent> events = publisher.eventsOfType(CircuitOpenedEvent.class);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).resource()).isEqualTo("trade-feed");
        assertThat(events.get(0).failureCount()).isEqualTo(2);
        assertThat(events.get(0).lastError()).isEqualTo("refused");
    }

    @Test
    void stopIsObservedAfterCurrentMessage() {
        connector.session("a", "b", "c");
        StreamManager manager = new StreamManager("trade-feed", connector, lenientBreaker(),
                StreamManager.Settings.defaults(), sleeper, clock, null);
        manager.start();

        manager.run(FEED, message -> {
            handled.add(message);
            manager.stop();
        });

        assertThat(handled).containsExactly("a");
        assertThat(connector.getOpens()).isEqualTo(1);
        assertThat(connector.getClosedSessions()).isEqualTo(1);
    }

    @Test
    void interruptDuringBackoffStopsLoop() {
        connector.failOpen("refused");
        StreamManager manager = new StreamManager("trade-feed", connector, lenientBreaker(),
                StreamManager.Settings.defaults(), duration -> {
                    throw new InterruptedException("shutdown");
                }, clock, null);
        manager.start();

        manager.run(FEED, handled::add);

        assertThat(Thread.interrupted()).isTrue();
        assertThat(manager.isRunning()).isFalse();
        assertThat(manager.getHealthSnapshot().errorCount()).isEqualTo(1);
    }

    @Test
    void notRunningLoopNeverConnects() {
        StreamManager manager = new StreamManager("trade-feed", connector, lenientBreaker(),
                StreamManager.Settings.defaults(), sleeper, clock, null);

        manager.run(FEED, handled::add);

        assertThat(connector.getOpens()).isZero();
    }

    @Test
    void failingCircuitOpenListenerDoesNotEndLoop() {
        connector.failOpen("refused").failOpen("refused").session("x");
        List<Object> attempted = new CopyOnWriteArrayList<>();
        StreamManager manager = new StreamManager("trade-feed", connector,
                new CircuitBreaker("trade-feed", 2, Duration.ofSeconds(10), clock),
                StreamManager.Settings.defaults(), sleeper, clock, event -> {
                    attempted.add(event);
                    throw new IllegalArgumentException("URI is not absolute");
                });
        connector.onExhausted(manager::stop);
        manager.start();

        assertThatCode(() -> manager.run(FEED, handled::add)).doesNotThrowAnyException();

        assertThat(attempted).singleElement().isInstanceOf(CircuitOpenedEvent.class);
        assertThat(handled).containsExactly("x");
        assertThat(manager.getHealthSnapshot().circuitState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void rejectsNonPositiveWaits() {
        assertThatThrownBy(() -> new StreamManager.Settings(Duration.ZERO, Duration.ofSeconds(32),
                Duration.ofSeconds(5), Duration.ofSeconds(30)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("initialBackoff");
        assertThatThrownBy(() -> new StreamManager.Settings(Duration.ofSeconds(1), Duration.ofSeconds(32),
                Duration.ofSeconds(-5), Duration.ofSeconds(30)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("breakerWait");
    }
}
