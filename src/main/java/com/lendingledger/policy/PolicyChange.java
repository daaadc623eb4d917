package com.lendingledger.policy;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit record of one policy or role change. Append-only.
 */
@Entity
@Table(name = "policy_changes", indexes = {
    @Index(name = "idx_policy_change_parameter", columnList = "parameter_name"),
    @Index(name = "idx_policy_change_changed_at", columnList = "changed_at")
})
@Data
@NoArgsConstructor
public class PolicyChange {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "parameter_name", nullable = false)
    private PolicyParameter parameter;

    @Column(name = "old_value")
    private String oldValue;

    @Column(name = "new_value")
    private String newValue;

    @Column(name = "changed_by")
    private String changedBy;

    @Column(name = "changed_at", nullable = false, updatable = false)
    private Instant changedAt;

    public PolicyChange(PolicyParameter parameter, String oldValue, String newValue,
                        String changedBy, Instant changedAt) {
        this.parameter = parameter;
        this.oldValue = oldValue;
        this.newValue = newValue;
        this.changedBy = changedBy;
        this.changedAt = changedAt;
    }
}
