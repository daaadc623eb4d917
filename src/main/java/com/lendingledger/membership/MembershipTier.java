package com.lendingledger.membership;

/**
 * Membership tiers. Informational; lending rules do not vary by tier.
 */
public enum MembershipTier {
    STANDARD,
    PATRON,
    INSTITUTIONAL
}
