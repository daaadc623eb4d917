package com.lendingledger.membership;

import java.util.Optional;

/**
 * Answers whether an account currently holds borrowing rights.
 *
 * The loan ledger only reads from the oracle; how memberships are issued is
 * up to the implementation.
 */
public interface MembershipOracle {

    /**
     * @return true if the account may borrow right now
     */
    boolean isMember(String accountId);

    /**
     * @return the tier of an active membership, empty if the account is not a member
     */
    Optional<MembershipTier> tierOf(String accountId);
}
