package com.ordinalcomparator.domain;

import java.math.BigDecimal;

/**
 * One valid BRC20 ledger entry. {@code amount} is the balance delta the operation applies
 * (null for deploys that carry no amount).
 */
public record Brc20Entry(
        String txid,
        String ticker,
        Brc20Operation operation,
        BigDecimal amount,
        String from,
        String to,
        String inscriptionId
) {
}
