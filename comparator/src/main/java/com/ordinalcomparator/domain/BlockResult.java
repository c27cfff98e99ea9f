package com.ordinalcomparator.domain;

import java.util.List;

/**
 * Finalized outcome for one height. Handed from a worker to the engine's ordering stage.
 */
public record BlockResult(long height, BlockStatus status, List<DivergenceEntry> divergences, String detail) {

    public BlockResult {
        divergences = divergences == null ? List.of() : List.copyOf(divergences);
    }

    public static BlockResult ok(long height, List<DivergenceEntry> divergences) {
        return new BlockResult(height, BlockStatus.OK, divergences, null);
    }

    public static BlockResult fetchFailed(long height, String detail) {
        return new BlockResult(height, BlockStatus.FETCH_FAILED, List.of(), detail);
    }

    public static BlockResult fatal(long height, String detail) {
        return new BlockResult(height, BlockStatus.FATAL, List.of(), detail);
    }

    public boolean hasDivergences() {
        return !divergences.isEmpty();
    }
}
