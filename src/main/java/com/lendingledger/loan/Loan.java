package com.lendingledger.loan;

import com.lendingledger.common.LoanKey;
import com.lendingledger.common.Money;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * An open loan of one unit of a catalog item to one borrower.
 *
 * A row exists only while the loan is open; returning the unit deletes it,
 * so the (borrower, item) key is free to be borrowed again. The deposit is
 * the amount actually paid at borrow time and does not follow later policy
 * changes.
 */
@Entity
@Table(name = "loans",
    uniqueConstraints = @UniqueConstraint(name = "uk_loan_borrower_item", columnNames = {"borrower_id", "item_id"}),
    indexes = @Index(name = "idx_loan_due_date", columnList = "due_date"))
@Data
@NoArgsConstructor
public class Loan {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "borrower_id", nullable = false)
    private String borrowerId;

    @Column(name = "item_id", nullable = false)
    private Long itemId;

    /**
     * Custodian the unit was lent from and goes back to.
     */
    @Column(name = "custodian_id", nullable = false)
    private String custodianId;

    @Column(name = "due_date", nullable = false)
    private Instant dueDate;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "deposit_amount")),
        @AttributeOverride(name = "currency", column = @Column(name = "deposit_currency"))
    })
    private Money depositAmount;

    @Column(name = "extensions_used", nullable = false)
    private int extensionsUsed;

    @Column(name = "opened_at", nullable = false, updatable = false)
    private Instant openedAt;

    @Version
    private Long version;

    public Loan(LoanKey key, String custodianId, Instant dueDate, Money depositAmount, Instant openedAt) {
        this.borrowerId = key.getBorrowerId();
        this.itemId = key.getItemId();
        this.custodianId = custodianId;
        this.dueDate = dueDate;
        this.depositAmount = depositAmount;
        this.extensionsUsed = 0;
        this.openedAt = openedAt;
    }

    public LoanKey key() {
        return LoanKey.of(borrowerId, itemId);
    }

    /**
     * A return is late only strictly after due date plus grace; returning at
     * exactly that instant is on time.
     */
    public boolean isLateAt(Instant now, Duration gracePeriod) {
        return now.isAfter(dueDate.plus(gracePeriod));
    }

    /**
     * Extensions are possible up to and including the due instant.
     */
    public boolean isPastDue(Instant now) {
        return now.isAfter(dueDate);
    }

    public void extend(Duration extension) {
        this.dueDate = this.dueDate.plus(extension);
        this.extensionsUsed++;
    }
}
