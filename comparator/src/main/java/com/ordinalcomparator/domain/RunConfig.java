package com.ordinalcomparator.domain;

/**
 * Immutable configuration of one run. {@code startHeight} and {@code endHeight} are optional:
 * a missing start defaults to the protocol's first active height on the chain, a missing end
 * is resolved from both endpoints' tips.
 */
public record RunConfig(
        ChainId chain,
        ProtocolId protocol,
        String primaryEndpoint,
        String secondaryEndpoint,
        Long startHeight,
        Long endHeight,
        int threadCount
) {

    public static final int DEFAULT_THREAD_COUNT = 100;

    public CheckpointKey checkpointKey() {
        return new CheckpointKey(chain, protocol, primaryEndpoint, secondaryEndpoint);
    }

    public long configuredStartOrDefault() {
        return startHeight != null ? startHeight : chain.firstActiveHeight(protocol);
    }

    /**
     * @throws IllegalArgumentException describing the first invalid field
     */
    public void validate() {
        if (chain == null) {
            throw new IllegalArgumentException("chain is required");
        }
        if (protocol == null) {
            throw new IllegalArgumentException("protocol is required");
        }
        if (primaryEndpoint == null || primaryEndpoint.isBlank()) {
            throw new IllegalArgumentException("primary endpoint is required");
        }
        if (secondaryEndpoint == null || secondaryEndpoint.isBlank()) {
            throw new IllegalArgumentException("secondary endpoint is required");
        }
        if (threadCount <= 0) {
            throw new IllegalArgumentException("threadCount must be positive: " + threadCount);
        }
        if (startHeight != null && startHeight < 0) {
            throw new IllegalArgumentException("start height must be non-negative: " + startHeight);
        }
        if (endHeight != null && endHeight < 0) {
            throw new IllegalArgumentException("end height must be non-negative: " + endHeight);
        }
        if (startHeight != null && endHeight != null && endHeight < startHeight) {
            throw new IllegalArgumentException(
                    "End block " + endHeight + " is less than start block " + startHeight);
        }
    }
}
