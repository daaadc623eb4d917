package com.lendingledger.ledger;

/**
 * Types of ledger events.
 *
 * Loan events describe the lifecycle of a (borrower, item) claim; deposit and
 * pool events describe where the escrowed money went.
 */
public enum LedgerEventType {
    /**
     * A borrow succeeded and a unit left the custodian.
     */
    LOAN_OPENED,

    /**
     * The due date of an open loan was pushed back.
     */
    LOAN_EXTENDED,

    /**
     * The unit came back on or before the end of the grace period.
     */
    LOAN_RETURNED,

    /**
     * The unit came back after the grace period ended.
     */
    LOAN_RETURNED_LATE,

    /**
     * A deposit was locked in escrow for an open loan.
     */
    DEPOSIT_LOCKED,

    /**
     * An escrowed deposit was released back to its borrower.
     */
    DEPOSIT_RELEASED,

    /**
     * An escrowed deposit moved to the forfeited pool.
     */
    DEPOSIT_FORFEITED,

    /**
     * The steward withdrew money from the forfeited pool.
     */
    POOL_WITHDRAWAL
}
