package com.lendingledger.rules;

import com.lendingledger.common.exception.LendingErrorCode;
import com.lendingledger.common.exception.LendingException;
import lombok.Value;

/**
 * Result of a rule evaluation.
 */
@Value
public class RuleResult {
    boolean approved;
    LendingErrorCode errorCode;
    String reason;

    public static RuleResult approve() {
        return new RuleResult(true, null, null);
    }

    public static RuleResult decline(LendingErrorCode errorCode, String reason) {
        return new RuleResult(false, errorCode, reason);
    }

    public LendingException toException() {
        if (approved) {
            throw new IllegalStateException("Approved result has no exception");
        }
        return errorCode.toException(reason);
    }
}
