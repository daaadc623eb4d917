package com.lendingledger.funds;

import com.lendingledger.common.Currency;
import com.lendingledger.common.Money;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Internal treasury holding every deposit received and not yet paid out.
 */
@Entity
@Table(name = "treasury")
@Data
@NoArgsConstructor
public class Treasury {

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

    public Treasury(Currency currency, Instant createdAt) {
        this.id = SINGLETON_ID;
        this.balance = Money.zero(currency);
        this.updatedAt = createdAt;
    }

    public void credit(Money amount, Instant at) {
        this.balance = this.balance.add(amount);
        this.updatedAt = at;
    }

    public void debit(Money amount, Instant at) {
        this.balance = this.balance.subtract(amount);
        this.updatedAt = at;
    }
}
