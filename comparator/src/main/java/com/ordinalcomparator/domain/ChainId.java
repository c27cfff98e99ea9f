package com.ordinalcomparator.domain;

/**
 * Chain both indexers must serve. Carries the network name reported by {@code /api/v1/node/info}
 * and the first heights at which each protocol has activity.
 */
public enum ChainId {
    BITCOIN("bitcoin", 767_430L, 779_832L),
    FRACTAL("fractal", 21_000L, 21_000L);

    private final String networkName;
    private final long firstInscriptionHeight;
    private final long firstBrc20Height;

    ChainId(String networkName, long firstInscriptionHeight, long firstBrc20Height) {
        this.networkName = networkName;
        this.firstInscriptionHeight = firstInscriptionHeight;
        this.firstBrc20Height = firstBrc20Height;
    }

    public String getNetworkName() {
        return networkName;
    }

    /**
     * Default start height for a run that does not configure one.
     */
    public long firstActiveHeight(ProtocolId protocol) {
        return switch (protocol) {
            case ORDINAL -> firstInscriptionHeight;
            case BRC20 -> firstBrc20Height;
        };
    }
}
