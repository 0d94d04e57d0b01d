package com.phillippitts.saleshud.service.transcription;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class ReconnectBackoffTest {

    @Test
    void shouldDoubleDelaysUntilCapped() {
        // Arrange
        ReconnectBackoff backoff = new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(5), 5);

        // Act / Assert
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(2));
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(4));
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(backoff.hasAttemptsRemaining()).isFalse();
    }

    @Test
    void shouldRejectAttemptsBeyondMaximum() {
        ReconnectBackoff backoff = new ReconnectBackoff(Duration.ofMillis(10), Duration.ofMillis(10), 1);
        backoff.nextDelay();

        assertThatThrownBy(backoff::nextDelay).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldStartOverAfterReset() {
        // Arrange
        ReconnectBackoff backoff = new ReconnectBackoff(Duration.ofMillis(100), Duration.ofSeconds(1), 3);
        backoff.nextDelay();
        backoff.nextDelay();

        // Act
        backoff.reset();

        // Assert
        assertThat(backoff.getAttempts()).isZero();
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofMillis(100));
    }

    @Test
    void shouldComputeDelayForAttemptNumber() {
        Duration initial = Duration.ofSeconds(1);
        Duration max = Duration.ofSeconds(30);

        assertThat(ReconnectBackoff.delayForAttempt(1, initial, max)).isEqualTo(Duration.ofSeconds(1));
        assertThat(ReconnectBackoff.delayForAttempt(3, initial, max)).isEqualTo(Duration.ofSeconds(4));
        assertThat(ReconnectBackoff.delayForAttempt(6, initial, max)).isEqualTo(Duration.ofSeconds(30));
        assertThat(ReconnectBackoff.delayForAttempt(40, initial, max)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        assertThatThrownBy(() -> new ReconnectBackoff(Duration.ofSeconds(2), Duration.ofSeconds(1), 3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(2), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
