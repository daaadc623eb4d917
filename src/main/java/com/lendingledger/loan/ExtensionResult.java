package com.lendingledger.loan;

import lombok.Value;

import java.time.Instant;

/**
 * Outcome of a granted extension.
 */
@Value
public class ExtensionResult {
    Instant newDueDate;
    int extensionsUsed;
}
