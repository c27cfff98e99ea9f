package com.ordinalcomparator.reconcile.config;

import com.ordinalcomparator.common.RetryPolicy;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Fetch retry policy (exponential backoff ± jitter). Applies per endpoint call.
 */
@ConfigurationProperties(prefix = "comparator.retry")
@NoArgsConstructor
@Getter
@Setter
public class RetryProperties {

    /** Delay before the first retry; doubles each attempt. */
    private long baseDelayMs = 1000L;

    /** Upper bound for a single backoff delay. */
    private long maxDelayMs = 60_000L;

    /** Jitter factor 0..1 (0.2 = ±20%). */
    private double jitterFactor = 0.2;

    /** Attempts per call, initial call included. */
    private int maxAttempts = 5;

    public RetryPolicy toRetryPolicy() {
        return new RetryPolicy(baseDelayMs, jitterFactor, maxAttempts, maxDelayMs);
    }
}
