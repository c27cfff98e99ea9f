package com.ordinalcomparator.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void backoffAfter_firstFailure_returnsJitteredBaseDelay() {
        RetryPolicy policy = new RetryPolicy(1000L, 0.2, 5);
        for (int i = 0; i < 20; i++) {
            long d = policy.backoffAfter(1).toMillis();
            assertThat(d).isBetween(800L, 1200L); // ±20% of 1000
        }
    }

    @Test
    void backoffAfter_doublesPerAttempt() {
        RetryPolicy policy = new RetryPolicy(1000L, 0, 5); // no jitter for deterministic test
        assertThat(policy.backoffAfter(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.backoffAfter(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.backoffAfter(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.backoffAfter(4)).isEqualTo(Duration.ofSeconds(8));
    }

    @Test
    void backoffAfter_isCappedByMaxDelay() {
        RetryPolicy policy = new RetryPolicy(1000L, 0, 10, 3000L);
        assertThat(policy.backoffAfter(6)).isEqualTo(Duration.ofMillis(3000));
    }

    @Test
    @DisplayName("5 attempts means 4 retries")
    void allowsRetryAfter_countsInitialAttempt() {
        RetryPolicy policy = new RetryPolicy(10L, 0, 5);
        assertThat(policy.allowsRetryAfter(1)).isTrue();
        assertThat(policy.allowsRetryAfter(4)).isTrue();
        assertThat(policy.allowsRetryAfter(5)).isFalse();
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new RetryPolicy(10L, 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(10L, 1.5, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(-1L, 0, 3)).isInstanceOf(IllegalArgumentException.class);
    }
}
