package com.delta.opportunities.pipeline.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delaysGrowExponentiallyUntilCapped() {
        RetryPolicy policy = new RetryPolicy(6, Duration.ofSeconds(30), 2.0, Duration.ofMinutes(3));

        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.delayAfter(2)).isEqualTo(Duration.ofSeconds(60));
        assertThat(policy.delayAfter(3)).isEqualTo(Duration.ofSeconds(120));
        assertThat(policy.delayAfter(4)).isEqualTo(Duration.ofMinutes(3));
        assertThat(policy.delayAfter(40)).isEqualTo(Duration.ofMinutes(3));
    }

    @Test
    void retriesAreAllowedUntilMaxAttemptsHaveFailed() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(10), 2.0, Duration.ofMillis(100));

        assertThat(policy.canRetryAfter(1)).isTrue();
        assertThat(policy.canRetryAfter(2)).isTrue();
        assertThat(policy.canRetryAfter(3)).isFalse();
    }

    @Test
    void nextAttemptIsOffsetFromFailureTime() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(5), 3.0, Duration.ofMinutes(1));
        Instant failedAt = Instant.parse("2026-03-01T10:00:00Z");

        assertThat(policy.nextAttemptAt(failedAt, 2)).isEqualTo(Instant.parse("2026-03-01T10:00:15Z"));
    }

    @Test
    void rejectsNonsensicalConfiguration() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, 2.0, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.ofSeconds(1), 0.5, Duration.ofSeconds(5)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
