package com.lendingledger.inventory;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Units of one item held by one holder.
 */
@Entity
@Table(name = "unit_holdings",
    uniqueConstraints = @UniqueConstraint(name = "uk_unit_holding", columnNames = {"holder_id", "item_id"}))
@Data
@NoArgsConstructor
public class UnitHolding {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "holder_id", nullable = false)
    private String holderId;

    @Column(name = "item_id", nullable = false)
    private Long itemId;

    @Column(nullable = false)
    private long quantity;

    public UnitHolding(String holderId, Long itemId) {
        this.holderId = holderId;
        this.itemId = itemId;
        this.quantity = 0;
    }

    public void credit(long units) {
        this.quantity += units;
    }

    public void debit(long units) {
        if (units > quantity) {
            throw new IllegalArgumentException(
                String.format("Cannot debit %d units from holding of %d", units, quantity));
        }
        this.quantity -= units;
    }
}
