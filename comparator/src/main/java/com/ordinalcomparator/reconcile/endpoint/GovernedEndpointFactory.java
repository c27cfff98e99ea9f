package com.ordinalcomparator.reconcile.endpoint;

import com.ordinalcomparator.reconcile.config.EndpointHttpProperties;
import com.ordinalcomparator.reconcile.config.RetryProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Wraps endpoints with their own rate limiter (per-endpoint request budget) and the configured retry policy.
 */
@Component
@RequiredArgsConstructor
public class GovernedEndpointFactory {

    private final IndexerEndpointFactory endpointFactory;
    private final RetryProperties retryProperties;
    private final EndpointHttpProperties httpProperties;

    public GovernedEndpoint create(String baseUrl) {
        int rps = Math.max(1, httpProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, httpProperties.getLimiterTimeoutMs())))
                .build();
        return new GovernedEndpoint(
                endpointFactory.create(baseUrl),
                RateLimiter.of("indexer " + baseUrl, config),
                retryProperties.toRetryPolicy());
    }
}
