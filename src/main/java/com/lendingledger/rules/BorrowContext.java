package com.lendingledger.rules;

import com.lendingledger.common.LoanKey;
import com.lendingledger.common.Money;
import com.lendingledger.policy.LendingPolicy;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Everything a borrow rule needs to decide on one borrow attempt.
 *
 * The policy is the one loaded by the enclosing transaction, so all rules and
 * the resulting loan see the same values.
 */
@Value
@Builder(toBuilder = true)
public class BorrowContext {
    String borrowerId;
    Long itemId;
    Money paidDeposit;
    Instant now;
    LendingPolicy policy;

    public LoanKey key() {
        return LoanKey.of(borrowerId, itemId);
    }
}
