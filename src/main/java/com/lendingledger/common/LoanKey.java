package com.lendingledger.common;

import lombok.Value;

/**
 * Identity of a loan claim: one borrower, one catalog item.
 */
@Value
public class LoanKey {
    String borrowerId;
    Long itemId;

    public static LoanKey of(String borrowerId, Long itemId) {
        return new LoanKey(borrowerId, itemId);
    }

    @Override
    public String toString() {
        return borrowerId + ":" + itemId;
    }
}
