package com.lendingledger.funds;

import com.lendingledger.common.Money;

/**
 * Where deposit money physically sits while the ledger tracks who it belongs to.
 *
 * The loan ledger credits the sink when a deposit arrives with a borrow and asks
 * it to pay out refunds and pool withdrawals. A payout is always the last effect
 * of the operation that triggers it; if it fails, the whole operation rolls back.
 *
 * Implementations may front a bank account, a payment processor or a purely
 * internal treasury.
 */
public interface FundsSink {

    /**
     * Record money received from a caller, e.g. the deposit sent with a borrow.
     */
    void received(Money amount);

    /**
     * Pay money out to an external account.
     *
     * @throws com.lendingledger.common.exception.InsufficientFundsException if the
     *         sink does not hold enough to cover the payout
     */
    void payOut(String toAccountId, Money amount);

    /**
     * Current balance held by the sink.
     */
    Money getBalance();
}
