package com.ordinalcomparator.domain;

/**
 * BRC20 ledger operation kinds.
 */
public enum Brc20Operation {
    DEPLOY,
    MINT,
    INSCRIBE_TRANSFER,
    TRANSFER,
    BURN
}
