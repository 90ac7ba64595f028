package com.phillippitts.champ.service.resilience;

import com.phillippitts.champ.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    private final MutableClock clock = MutableClock.atEpochSecond(1_700_000_000L);

    @Test
    void opensAfterMaxFailures() {
        CircuitBreaker breaker = new CircuitBreaker("feed", 3, Duration.ofSeconds(60), clock);

        breaker.onFailure();
        breaker.onFailure();
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.canExecute()).isTrue();

        breaker.onFailure();
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.canExecute()).isFalse();
        assertThat(breaker.getFailureCount()).isEqualTo(3);
    }

    @Test
    void staysOpenUntilTimeoutElapsedThenHalfOpens() {
        CircuitBreaker breaker = new CircuitBreaker("feed", 2, Duration.ofSeconds(60), clock);
        breaker.onFailure();
        breaker.onFailure();

        clock.advance(Duration.ofSeconds(60));
        assertThat(breaker.canExecute()).isFalse();
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);

        clock.advance(Duration.ofSeconds(1));
        assertThat(breaker.canExecute()).isTrue();
        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
    }

    @Test
    void halfOpenSuccessClosesAndResetsCount() {
        CircuitBreaker breaker = new CircuitBreaker("feed", 2, Duration.ofSeconds(60), clock);
        breaker.onFailure();
        breaker.onFailure();
        clock.advance(Duration.ofSeconds(61));
        assertThat(breaker.canExecute()).isTrue();

        breaker.onSuccess();

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getFailureCount()).isZero();
        breaker.onFailure();
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void halfOpenFailureReopensWithFreshTimer() {
        CircuitBreaker breaker = new CircuitBreaker("feed", 2, Duration.ofSeconds(60), clock);
        breaker.onFailure();
        breaker.onFailure();
        clock.advance(Duration.ofSeconds(61));
        assertThat(breaker.canExecute()).isTrue();

        breaker.onFailure();

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        clock.advance(Duration.ofSeconds(30));
        assertThat(breaker.canExecute()).isFalse();
        clock.advance(Duration.ofSeconds(31));
        assertThat(breaker.canExecute()).isTrue();
    }

    @Test
    void oneBelowThresholdThenSuccessStaysClosed() {
        CircuitBreaker breaker = new CircuitBreaker("feed", 5, Duration.ofSeconds(60), clock);
        for (int i = 0; i < 4; i++) {
            breaker.onFailure();
        }
        breaker.onSuccess();

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getFailureCount()).isZero();
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new CircuitBreaker("feed", 0, Duration.ofSeconds(1), clock))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CircuitBreaker("feed", 1, Duration.ZERO, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
