package com.ordinalcomparator.domain;

/**
 * Protocol whose receipts are compared. {@code apiSegment} is the path segment of the indexer events API.
 */
public enum ProtocolId {
    ORDINAL("ord"),
    BRC20("brc20");

    private final String apiSegment;

    ProtocolId(String apiSegment) {
        this.apiSegment = apiSegment;
    }

    public String getApiSegment() {
        return apiSegment;
    }
}
