package com.lendingledger.common;

import com.lendingledger.common.exception.InvalidValueException;
import com.lendingledger.common.exception.LendingErrorCode;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Immutable value object representing a monetary amount with currency.
 * Uses BigDecimal for precise decimal arithmetic; deposits, escrow holds and
 * the forfeited pool are all expressed in it.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Money {

    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    private Currency currency;

    public static Money of(BigDecimal amount, Currency currency) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        if (currency == null) {
            throw new IllegalArgumentException("Currency cannot be null");
        }
        return new Money(amount.setScale(2, RoundingMode.HALF_UP), currency);
    }

    /**
     * Money for an amount actually paid or requested, which must already be in
     * whole cents. Unlike {@link #of(BigDecimal, Currency)} it never rounds.
     */
    public static Money exact(BigDecimal amount, Currency currency) {
        if (amount != null && amount.stripTrailingZeros().scale() > 2) {
            throw new InvalidValueException(LendingErrorCode.INVALID_AMOUNT,
                "Amount has more than two decimal places: " + amount.toPlainString());
        }
        return of(amount, currency);
    }

    public static Money of(String amount, Currency currency) {
        return of(new BigDecimal(amount), currency);
    }

    public static Money zero(Currency currency) {
        return of(BigDecimal.ZERO, currency);
    }

    public Money add(Money other) {
        validateSameCurrency(other);
        return new Money(this.amount.add(other.amount), this.currency);
    }

    public Money subtract(Money other) {
        validateSameCurrency(other);
        return new Money(this.amount.subtract(other.amount), this.currency);
    }

    public boolean isGreaterThan(Money other) {
        validateSameCurrency(other);
        return this.amount.compareTo(other.amount) > 0;
    }

    public boolean isGreaterThanOrEqual(Money other) {
        validateSameCurrency(other);
        return this.amount.compareTo(other.amount) >= 0;
    }

    public boolean isLessThan(Money other) {
        validateSameCurrency(other);
        return this.amount.compareTo(other.amount) < 0;
    }

    public boolean isPositive() {
        return this.amount.compareTo(BigDecimal.ZERO) > 0;
    }

    public boolean isZero() {
        return this.amount.compareTo(BigDecimal.ZERO) == 0;
    }

    public boolean isSameCurrency(Money other) {
        return this.currency == other.currency;
    }

    /**
     * Numeric equality ignoring scale, e.g. 5.0 USD equals 5.00 USD.
     */
    public boolean isEqualTo(Money other) {
        return isSameCurrency(other) && this.amount.compareTo(other.amount) == 0;
    }

    private void validateSameCurrency(Money other) {
        if (!isSameCurrency(other)) {
            throw new IllegalArgumentException(
                String.format("Cannot perform operation on different currencies: %s and %s",
                    this.currency, other.currency)
            );
        }
    }

    @Override
    public String toString() {
        return amount.toPlainString() + " " + currency;
    }
}
