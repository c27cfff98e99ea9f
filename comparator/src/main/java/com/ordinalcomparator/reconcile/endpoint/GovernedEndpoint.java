package com.ordinalcomparator.reconcile.endpoint;

import com.ordinalcomparator.common.RetryPolicy;
import com.ordinalcomparator.domain.ChainId;
import com.ordinalcomparator.domain.ProtocolId;
import com.ordinalcomparator.domain.Receipts;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * An {@link IndexerEndpoint} behind a per-endpoint request budget and the retry policy.
 * Transient failures are retried with backoff; schema failures are not. The stop signal and the
 * thread's interrupt flag are checked before every attempt and while backing off.
 */
@Slf4j
public class GovernedEndpoint {

    private static final long BACKOFF_SLICE_MS = 100;

    private final IndexerEndpoint delegate;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;

    public GovernedEndpoint(IndexerEndpoint delegate, RateLimiter rateLimiter, RetryPolicy retryPolicy) {
        this.delegate = delegate;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
    }

    public String baseUrl() {
        return delegate.baseUrl();
    }

    /**
     * @throws TransientFetchException when the retry budget is exhausted
     * @throws SchemaException         on the first non-retriable failure
     * @throws FetchAbortedException   when stop is requested or the thread is interrupted
     */
    public Receipts fetch(ChainId chain, ProtocolId protocol, long height, BooleanSupplier stopRequested) {
        return withRetry("block " + height, stopRequested, () -> delegate.fetch(chain, protocol, height));
    }

    /**
     * Latest indexed height, after the endpoint's network has been checked against {@code chain}.
     *
     * @throws FetchAbortedException when stop is requested or the thread is interrupted
     */
    public long tip(ChainId chain, BooleanSupplier stopRequested) {
        return withRetry("tip", stopRequested, () -> delegate.tip(chain));
    }

    private <T> T withRetry(String what, BooleanSupplier stopRequested, Supplier<T> call) {
        for (int attempt = 1; ; attempt++) {
            checkNotAborted(what, stopRequested);
            EndpointException failure;
            try {
                acquirePermit(what);
                return call.get();
            } catch (FetchAbortedException e) {
                throw e;
            } catch (EndpointException e) {
                if (!e.getKind().isRetriable()) {
                    throw e;
                }
                failure = e;
            } catch (RuntimeException e) {
                failure = new TransientFetchException(FetchErrorKind.UNAVAILABLE,
                        what + " from " + baseUrl() + ": " + e, e);
            }
            if (!retryPolicy.allowsRetryAfter(attempt)) {
                log.warn("Giving up on {} from {} after {} attempts: {}", what, baseUrl(), attempt, failure.getMessage());
                throw new TransientFetchException(failure.getKind(),
                        what + " from " + baseUrl() + " failed after " + attempt + " attempts: " + failure.getMessage(),
                        failure);
            }
            Duration delay = retryPolicy.backoffAfter(attempt);
            log.debug("Attempt {} for {} from {} failed ({}), retrying in {} ms",
                    attempt, what, baseUrl(), failure.getKind(), delay.toMillis());
            pause(delay, what, stopRequested);
        }
    }

    private void acquirePermit(String what) {
        if (!rateLimiter.acquirePermission()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new FetchAbortedException("Interrupted while waiting for a request permit for " + what);
            }
            throw new TransientFetchException(FetchErrorKind.UNAVAILABLE,
                    "request budget of " + baseUrl() + " exhausted for " + what);
        }
    }

    private void pause(Duration delay, String what, BooleanSupplier stopRequested) {
        long remaining = delay.toMillis();
        try {
            while (remaining > 0) {
                long slice = Math.min(remaining, BACKOFF_SLICE_MS);
                Thread.sleep(slice);
                remaining -= slice;
                checkNotAborted(what, stopRequested);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchAbortedException("Interrupted during retry backoff for " + what, e);
        }
    }

    private static void checkNotAborted(String what, BooleanSupplier stopRequested) {
        if (Thread.currentThread().isInterrupted()) {
            throw new FetchAbortedException("Interrupted before fetching " + what);
        }
        if (stopRequested.getAsBoolean()) {
            throw new FetchAbortedException("Stop requested before fetching " + what);
        }
    }
}
