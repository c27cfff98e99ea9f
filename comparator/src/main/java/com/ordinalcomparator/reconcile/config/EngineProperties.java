package com.ordinalcomparator.reconcile.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "comparator.engine")
@NoArgsConstructor
@Getter
@Setter
public class EngineProperties {

    /**
     * When true a FETCH_FAILED height is reported as unverified and the checkpoint moves past it.
     * When false the run fails at that height and the next run retries it.
     */
    private boolean tolerateGaps = false;

    /** Reorder buffer capacity as a multiple of the worker count. */
    private int reorderWindowFactor = 2;

    /** How long cancellation waits for in-flight blocks before abandoning them. */
    private long shutdownGracePeriodMs = 30_000;

    /** Width of the height buckets in the run summary. */
    private long heightBucketSize = 1_000;

    /** Interval of the progress log line while a run is active. */
    private long progressIntervalMs = 10_000;
}
