package com.lendingledger.ledger;

import com.lendingledger.common.Money;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of one loan or escrow event.
 *
 * Ledger entries are never updated or deleted - they are append-only. Once a
 * deposit is forfeited, its entry is the only trace linking the pooled money
 * back to the loan it came from.
 */
@Entity
@Table(name = "ledger_entries", indexes = {
    @Index(name = "idx_ledger_borrower_id", columnList = "borrower_id"),
    @Index(name = "idx_ledger_item_id", columnList = "item_id"),
    @Index(name = "idx_ledger_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
public class LedgerEntry {

    @Id
    private String entryId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false)
    private LedgerEventType eventType;

    /**
     * Borrower of the loan, null for pool withdrawals.
     */
    @Column(name = "borrower_id")
    private String borrowerId;

    @Column(name = "item_id")
    private Long itemId;

    /**
     * The other side of a money movement or unit transfer: the custodian on
     * loan events, the payee on withdrawals.
     */
    @Column(name = "counterparty_id")
    private String counterpartyId;

    /**
     * Money moved by this event, null for events that move none.
     */
    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "amount")),
        @AttributeOverride(name = "currency", column = @Column(name = "currency"))
    })
    private Money amount;

    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public LedgerEntry(LedgerEventType eventType, String borrowerId, Long itemId,
                       String counterpartyId, Money amount, String description,
                       Instant createdAt) {
        this.entryId = UUID.randomUUID().toString();
        this.eventType = eventType;
        this.borrowerId = borrowerId;
        this.itemId = itemId;
        this.counterpartyId = counterpartyId;
        this.amount = amount;
        this.description = description;
        this.createdAt = createdAt;
    }
}
