package com.ordinalcomparator.reconcile.scheduler;

import com.ordinalcomparator.domain.BlockResult;
import com.ordinalcomparator.domain.ChainId;
import com.ordinalcomparator.domain.DivergenceEntry;
import com.ordinalcomparator.domain.ProtocolId;
import com.ordinalcomparator.domain.Receipts;
import com.ordinalcomparator.reconcile.compare.ReceiptComparator;
import com.ordinalcomparator.reconcile.endpoint.FetchAbortedException;
import com.ordinalcomparator.reconcile.endpoint.GovernedEndpoint;
import com.ordinalcomparator.reconcile.endpoint.SchemaException;
import com.ordinalcomparator.reconcile.endpoint.TransientFetchException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;

/**
 * Fetches one height from both endpoints concurrently, joins, and compares.
 */
@Slf4j
public class FetchCompareTask implements BlockTask {

    private final GovernedEndpoint primary;
    private final GovernedEndpoint secondary;
    private final ChainId chain;
    private final ProtocolId protocol;
    private final ReceiptComparator comparator;

    public FetchCompareTask(GovernedEndpoint primary, GovernedEndpoint secondary, ChainId chain, ProtocolId protocol,
                            ReceiptComparator comparator) {
        this.primary = primary;
        this.secondary = secondary;
        this.chain = chain;
        this.protocol = protocol;
        this.comparator = comparator;
    }

    @Override
    public BlockResult execute(long height, Executor fetchExecutor, BooleanSupplier stopRequested) {
        CompletableFuture<Outcome> left = CompletableFuture
                .supplyAsync(() -> primary.fetch(chain, protocol, height, stopRequested), fetchExecutor)
                .handle(Outcome::new);
        CompletableFuture<Outcome> right = CompletableFuture
                .supplyAsync(() -> secondary.fetch(chain, protocol, height, stopRequested), fetchExecutor)
                .handle(Outcome::new);

        Outcome p = await(left, height);
        Outcome s = await(right, height);

        if (p.failure() instanceof SchemaException || s.failure() instanceof SchemaException) {
            String detail = describe(p, s, SchemaException.class);
            log.error("Invalid response at height {}: {}", height, detail);
            return BlockResult.fatal(height, detail);
        }
        if (p.failure() instanceof FetchAbortedException aborted) {
            throw aborted;
        }
        if (s.failure() instanceof FetchAbortedException aborted) {
            throw aborted;
        }
        if (p.failure() instanceof TransientFetchException || s.failure() instanceof TransientFetchException) {
            String detail = describe(p, s, TransientFetchException.class);
            log.warn("Height {} unverified: {}", height, detail);
            return BlockResult.fetchFailed(height, detail);
        }
        rethrowUnexpected(p);
        rethrowUnexpected(s);

        List<DivergenceEntry> divergences = comparator.compare(height, p.receipts(), s.receipts());
        log.debug("Height {} compared: {} primary, {} secondary, {} divergences",
                height, p.receipts().size(), s.receipts().size(), divergences.size());
        return BlockResult.ok(height, divergences);
    }

    private static Outcome await(CompletableFuture<Outcome> future, long height) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new FetchAbortedException("Interrupted while fetching height " + height, e);
        } catch (ExecutionException e) {
            // handle() never completes exceptionally
            throw new IllegalStateException("Unexpected fetch failure at height " + height, e.getCause());
        }
    }

    private String describe(Outcome p, Outcome s, Class<? extends RuntimeException> type) {
        StringBuilder sb = new StringBuilder();
        if (type.isInstance(p.failure())) {
            sb.append("primary ").append(primary.baseUrl()).append(": ").append(p.failure().getMessage());
        }
        if (type.isInstance(s.failure())) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append("secondary ").append(secondary.baseUrl()).append(": ").append(s.failure().getMessage());
        }
        return sb.toString();
    }

    private static void rethrowUnexpected(Outcome outcome) {
        if (outcome.failure() instanceof RuntimeException e) {
            throw e;
        }
        if (outcome.failure() != null) {
            throw new IllegalStateException(outcome.failure());
        }
    }

    private record Outcome(Receipts receipts, Throwable failure) {

        Outcome {
            if (failure instanceof CompletionException && failure.getCause() != null) {
                failure = failure.getCause();
            }
        }
    }
}
