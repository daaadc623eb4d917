package com.lendingledger.common;

/**
 * Currencies a deposit may be denominated in.
 * The active policy fixes one of them for every deposit.
 */
public enum Currency {
    USD,
    EUR,
    GBP
}
