package com.realtime.dm.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconnectBackoffTest {

    @Test
    @DisplayName("500ms 부터 두 배씩, 30초에서 멈춘다")
    void doublesUpToCap() {
        ReconnectBackoff backoff = new ReconnectBackoff();

        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofMillis(500));
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofMillis(1000));
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofMillis(2000));
        for (int i = 0; i < 20; i++) backoff.nextDelay();
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("reset 하면 처음부터")
    void resetStartsOver() {
        ReconnectBackoff backoff = new ReconnectBackoff();
        backoff.nextDelay();
        backoff.nextDelay();

        backoff.reset();

        assertThat(backoff.attempts()).isZero();
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    @DisplayName("잘못된 설정은 거부")
    void rejectsBadSettings() {
        assertThatThrownBy(() -> new ReconnectBackoff(Duration.ZERO, 2, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReconnectBackoff(Duration.ofSeconds(2), 2, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
