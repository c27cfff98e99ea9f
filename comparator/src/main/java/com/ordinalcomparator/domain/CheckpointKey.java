package com.ordinalcomparator.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Identity of a checkpoint: one per (chain, protocol, primary endpoint, secondary endpoint).
 */
public record CheckpointKey(ChainId chain, ProtocolId protocol, String primaryEndpoint, String secondaryEndpoint) {

    public CheckpointKey {
        if (chain == null || protocol == null || primaryEndpoint == null || secondaryEndpoint == null) {
            throw new IllegalArgumentException("chain, protocol and both endpoints are required");
        }
    }

    /**
     * SHA-256 hex of the tuple. Stable across runs; used as the storage id.
     */
    public String fingerprint() {
        String canonical = chain.name() + "|" + protocol.name() + "|" + primaryEndpoint + "|" + secondaryEndpoint;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
