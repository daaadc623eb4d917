package com.lendingledger.membership;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Borrowing rights of one account. Revoked memberships are kept for history.
 */
@Entity
@Table(name = "memberships")
@Data
@NoArgsConstructor
public class Membership {

    @Id
    @Column(name = "account_id")
    private String accountId;

    @Enumerated(EnumType.STRING)
    private MembershipTier tier;

    private boolean active;

    @Column(name = "granted_by")
    private String grantedBy;

    @Column(name = "granted_at")
    private Instant grantedAt;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    public Membership(String accountId, MembershipTier tier, String grantedBy, Instant grantedAt) {
        this.accountId = accountId;
        grant(tier, grantedBy, grantedAt);
    }

    public void grant(MembershipTier tier, String grantedBy, Instant grantedAt) {
        this.tier = tier;
        this.active = true;
        this.grantedBy = grantedBy;
        this.grantedAt = grantedAt;
        this.revokedAt = null;
    }

    public void revoke(Instant at) {
        this.active = false;
        this.revokedAt = at;
    }
}
