package com.lendingledger.policy;

import com.lendingledger.common.Currency;
import com.lendingledger.common.Money;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * The single active lending policy.
 *
 * Durations are stored as whole seconds. A null steward means stewardship
 * has been renounced; a null custodian means no branch is configured yet.
 */
@Entity
@Table(name = "lending_policy")
@Data
@NoArgsConstructor
public class LendingPolicy {

    public static final Long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(name = "loan_duration_seconds", nullable = false)
    private long loanDurationSeconds;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "deposit_amount")),
        @AttributeOverride(name = "currency", column = @Column(name = "deposit_currency"))
    })
    private Money depositAmount;

    @Column(name = "grace_period_seconds", nullable = false)
    private long gracePeriodSeconds;

    @Column(name = "extension_duration_seconds", nullable = false)
    private long extensionDurationSeconds;

    @Column(name = "max_extensions", nullable = false)
    private int maxExtensions;

    @Column(name = "custodian_id")
    private String custodianId;

    @Column(name = "steward_id")
    private String stewardId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "policy_curators", joinColumns = @JoinColumn(name = "policy_id"))
    @Column(name = "curator_id")
    private Set<String> curatorIds = new HashSet<>();

    @Column(name = "updated_at")
    private Instant updatedAt;

    public LendingPolicy(Duration loanDuration, Money depositAmount, Duration gracePeriod,
                         Duration extensionDuration, int maxExtensions,
                         String custodianId, String stewardId) {
        this.id = SINGLETON_ID;
        this.loanDurationSeconds = loanDuration.getSeconds();
        this.depositAmount = depositAmount;
        this.gracePeriodSeconds = gracePeriod.getSeconds();
        this.extensionDurationSeconds = extensionDuration.getSeconds();
        this.maxExtensions = maxExtensions;
        this.custodianId = custodianId;
        this.stewardId = stewardId;
    }

    public Duration getLoanDuration() {
        return Duration.ofSeconds(loanDurationSeconds);
    }

    public Duration getGracePeriod() {
        return Duration.ofSeconds(gracePeriodSeconds);
    }

    public Duration getExtensionDuration() {
        return Duration.ofSeconds(extensionDurationSeconds);
    }

    public Currency getCurrency() {
        return depositAmount.getCurrency();
    }

    public boolean isCustodianConfigured() {
        return custodianId != null && !custodianId.isBlank();
    }

    public boolean isStewardless() {
        return stewardId == null;
    }
}
