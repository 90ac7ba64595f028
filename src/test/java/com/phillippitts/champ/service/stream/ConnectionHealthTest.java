package com.phillippitts.champ.service.stream;

import com.phillippitts.champ.service.resilience.CircuitState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionHealthTest {

    private static final Duration GRACE = Duration.ofSeconds(30);
    private static final Instant T0 = Instant.parse("2024-06-01T12:00:00Z");

    @Test
    void noDowntimeBeforeFirstMessage() {
        ConnectionHealth health = new ConnectionHealth();

        StreamHealthSnapshot snapshot = health.snapshot(T0.plusSeconds(500), GRACE, CircuitState.CLOSED);

        assertThat(snapshot.currentDowntime()).isZero();
        assertThat(snapshot.totalDowntime()).isZero();
        assertThat(snapshot.lastMessageTime()).isNull();
    }

    @Test
    void currentDowntimeIsGapBeyondGrace() {
        ConnectionHealth health = new ConnectionHealth();
        health.recordMessage(T0, GRACE);

        assertThat(health.snapshot(T0.plusSeconds(10), GRACE, CircuitState.CLOSED).currentDowntime()).isZero();
        StreamHealthSnapshot late = health.snapshot(T0.plusSeconds(50), GRACE, CircuitState.CLOSED);
        assertThat(late.currentDowntime()).isEqualTo(Duration.ofSeconds(20));
        assertThat(late.totalDowntime()).isEqualTo(Duration.ofSeconds(20));
    }

    @Test
    void gapIsFoldedIntoTotalWhenNextMessageArrives() {
        ConnectionHealth health = new ConnectionHealth();
        health.recordMessage(T0, GRACE);
        health.recordMessage(T0.plusSeconds(50), GRACE);
        health.recordMessage(T0.plusSeconds(60), GRACE);

        StreamHealthSnapshot snapshot = health.snapshot(T0.plusSeconds(60), GRACE, CircuitState.HALF_OPEN);

        assertThat(snapshot.messageCount()).isEqualTo(3);
        assertThat(snapshot.currentDowntime()).isZero();
        assertThat(snapshot.totalDowntime()).isEqualTo(Duration.ofSeconds(20));
        assertThat(snapshot.circuitState()).isEqualTo(CircuitState.HALF_OPEN);
    }

    @Test
    void snapshotDoesNotMutateTotals() {
        ConnectionHealth health = new ConnectionHealth();
        health.recordMessage(T0, GRACE);
        health.snapshot(T0.plusSeconds(100), GRACE, CircuitState.CLOSED);

        StreamHealthSnapshot again = health.snapshot(T0.plusSeconds(40), GRACE, CircuitState.CLOSED);

        assertThat(again.totalDowntime()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void mapUsesSecondsAndStateName() {
        ConnectionHealth health = new ConnectionHealth();
        health.recordConnected();
        health.recordError();
        health.recordMessage(T0, GRACE);

        var map = health.snapshot(T0.plusSeconds(45), GRACE, CircuitState.OPEN).toMap();

        assertThat(map)
                .containsEntry("message_count", 1L)
                .containsEntry("error_count", 1L)
                .containsEntry("reconnect_count", 1L)
                .containsEntry("current_downtime", 15.0)
                .containsEntry("circuit_breaker_state", "OPEN")
                .containsEntry("last_message_time", T0.toString());
    }
}
