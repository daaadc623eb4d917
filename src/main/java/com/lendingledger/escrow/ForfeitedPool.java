package com.lendingledger.escrow;

import com.lendingledger.common.Currency;
import com.lendingledger.common.Money;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Aggregate of every deposit kept after a late return.
 *
 * The pool is not itemized: once a deposit is added, only the ledger entry
 * recorded at forfeiture ties it back to its loan.
 */
@Entity
@Table(name = "forfeited_pool")
@Data
@NoArgsConstructor
public class ForfeitedPool {

    public static final Long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "balance_amount")),
        @AttributeOverride(name = "currency", column = @Column(name = "balance_currency"))
    })
    private Money balance;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public ForfeitedPool(Currency currency, Instant createdAt) {
        this.id = SINGLETON_ID;
        this.balance = Money.zero(currency);
        this.updatedAt = createdAt;
    }

    public void add(Money amount, Instant at) {
        this.balance = this.balance.add(amount);
        this.updatedAt = at;
    }

    public void withdraw(Money amount, Instant at) {
        if (amount.isGreaterThan(balance)) {
            throw new IllegalArgumentException("Cannot withdraw more than the pool holds");
        }
        this.balance = this.balance.subtract(amount);
        this.updatedAt = at;
    }
}
