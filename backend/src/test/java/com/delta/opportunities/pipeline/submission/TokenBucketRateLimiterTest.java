package com.delta.opportunities.pipeline.submission;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TokenBucketRateLimiterTest {

    @Test
    void allowsBurstThenRefillsAtRate() {
        AtomicLong now = new AtomicLong(0);
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(2.0, 3, now::get);

        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isFalse();

        now.addAndGet(500_000_000L);
        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isFalse();
    }

    @Test
    void refillNeverExceedsBurst() {
        AtomicLong now = new AtomicLong(0);
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(10.0, 2, now::get);
        limiter.tryAcquire();

        now.addAndGet(60_000_000_000L);

        assertThat(limiter.availableTokens()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void rejectsNonPositiveRate() {
        assertThatThrownBy(() -> new TokenBucketRateLimiter(0.0, 1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
