package com.ordinalcomparator.reconcile.scheduler;

import com.ordinalcomparator.domain.BlockResult;

import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;

/**
 * Work for one height: fetch both sides and compare.
 */
@FunctionalInterface
public interface BlockTask {

    /**
     * @param fetchExecutor pool for the concurrent fetches of this height
     * @param stopRequested checked between retry attempts
     * @return the finalized result for {@code height}
     * @throws com.ordinalcomparator.reconcile.endpoint.FetchAbortedException when stopped before a result exists
     */
    BlockResult execute(long height, Executor fetchExecutor, BooleanSupplier stopRequested);
}
