package com.lendingledger.policy;

/**
 * Audited policy and role settings.
 */
public enum PolicyParameter {
    LOAN_DURATION,
    DEPOSIT_AMOUNT,
    GRACE_PERIOD,
    EXTENSION_DURATION,
    MAX_EXTENSIONS,
    CUSTODIAN,
    STEWARD,
    CURATOR_GRANTED,
    CURATOR_REVOKED
}
