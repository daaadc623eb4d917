package com.lendingledger.common.exception;

import com.lendingledger.common.Money;

/**
 * Thrown when a balance cannot cover a payout or withdrawal.
 */
public class InsufficientFundsException extends LendingException {

    public InsufficientFundsException(String balanceName, Money required, Money available) {
        super(LendingErrorCode.INSUFFICIENT_FUNDS,
            String.format("Insufficient funds in %s. Required: %s %s, Available: %s %s",
                balanceName,
                required.getAmount(), required.getCurrency(),
                available.getAmount(), available.getCurrency()));
    }
}
