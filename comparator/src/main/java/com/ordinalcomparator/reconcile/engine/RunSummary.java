package com.ordinalcomparator.reconcile.engine;

import com.ordinalcomparator.domain.DivergenceKind;
import com.ordinalcomparator.domain.HeightRange;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Outcome of one run. "Divergence found" and "verification incomplete" are reported separately:
 * a run can be complete and divergent, or clean so far but incomplete.
 *
 * @param range                  effective range, null when the run failed before it was resolved
 * @param lastReconciledHeight   checkpoint value at the end of the run, null when none exists
 * @param divergencesByBucket    divergence count per height bucket, keyed by the bucket's first height
 * @param unverifiedHeights      heights finalized as FETCH_FAILED
 * @param failure                reason for FAILED, null otherwise
 */
public record RunSummary(
        EngineState state,
        HeightRange range,
        long processedBlocks,
        long divergentBlocks,
        Long lastReconciledHeight,
        Map<DivergenceKind, Long> divergencesByKind,
        SortedMap<Long, Long> divergencesByBucket,
        List<Long> unverifiedHeights,
        String failure,
        Duration elapsed
) {

    public RunSummary {
        EnumMap<DivergenceKind, Long> byKind = new EnumMap<>(DivergenceKind.class);
        if (divergencesByKind != null) {
            byKind.putAll(divergencesByKind);
        }
        divergencesByKind = Collections.unmodifiableMap(byKind);
        divergencesByBucket = Collections.unmodifiableSortedMap(
                divergencesByBucket == null ? new TreeMap<>() : new TreeMap<>(divergencesByBucket));
        unverifiedHeights = unverifiedHeights == null ? List.of() : List.copyOf(unverifiedHeights);
    }

    public long totalDivergences() {
        return divergencesByKind.values().stream().mapToLong(Long::longValue).sum();
    }

    public boolean divergenceFound() {
        return totalDivergences() > 0;
    }

    /** True when some height in range has no conclusive comparison. */
    public boolean verificationIncomplete() {
        return state != EngineState.COMPLETED || !unverifiedHeights.isEmpty();
    }

    /** Seconds per processed block; 0 when nothing was processed. */
    public double secondsPerBlock() {
        return processedBlocks == 0 ? 0.0 : elapsed.toMillis() / 1000.0 / processedBlocks;
    }
}
