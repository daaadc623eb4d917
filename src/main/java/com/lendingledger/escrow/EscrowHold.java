package com.lendingledger.escrow;

import com.lendingledger.common.LoanKey;
import com.lendingledger.common.Money;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Deposit held in escrow for one open loan.
 */
@Entity
@Table(name = "escrow_holds",
    uniqueConstraints = @UniqueConstraint(name = "uk_escrow_hold_loan", columnNames = {"borrower_id", "item_id"}))
@Data
@NoArgsConstructor
public class EscrowHold {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "borrower_id", nullable = false)
    private String borrowerId;

    @Column(name = "item_id", nullable = false)
    private Long itemId;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "amount")),
        @AttributeOverride(name = "currency", column = @Column(name = "currency"))
    })
    private Money amount;

    @Column(name = "locked_at", nullable = false)
    private Instant lockedAt;

    public EscrowHold(LoanKey key, Money amount, Instant lockedAt) {
        this.borrowerId = key.getBorrowerId();
        this.itemId = key.getItemId();
        this.amount = amount;
        this.lockedAt = lockedAt;
    }

    public LoanKey key() {
        return LoanKey.of(borrowerId, itemId);
    }
}
