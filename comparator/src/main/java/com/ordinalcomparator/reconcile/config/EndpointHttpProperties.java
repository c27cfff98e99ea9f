package com.ordinalcomparator.reconcile.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * HTTP timeouts, per-endpoint request budget and block hash cache for indexer calls.
 */
@ConfigurationProperties(prefix = "comparator.http")
@NoArgsConstructor
@Getter
@Setter
public class EndpointHttpProperties {

    /** Timeout for a block events request. */
    private long requestTimeoutMs = 30_000;

    /** Timeout for a height to block hash lookup. */
    private long blockHashTimeoutMs = 5_000;

    /** Timeout for node info (tip) requests. */
    private long nodeInfoTimeoutMs = 10_000;

    /** Request budget per endpoint (requests per second, all call kinds). */
    private int maxRequestsPerSecond = 50;

    /** How long a call may wait for a rate limiter permit before it counts as a transient failure. */
    private long limiterTimeoutMs = 5_000;

    /** Block hashes kept per endpoint so retries do not resolve the same height twice. */
    private long blockHashCacheSize = 10_000;
}
