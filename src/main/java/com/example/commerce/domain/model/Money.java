package com.example.commerce.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Value Object representing a non-negative monetary amount with currency.
 * Amounts are kept at two decimal places, rounded half-up.
 */
public final class Money {

    public static final String DEFAULT_CURRENCY = "ETB";
    private static final int SCALE = 2;

    private final BigDecimal amount;
    private final String currency;

    private Money(BigDecimal amount, String currency) {
        this.amount = amount.setScale(SCALE, RoundingMode.HALF_UP);
        this.currency = Objects.requireNonNull(currency, "Currency cannot be null");
    }

    /**
     * Creates Money in the default currency.
     *
     * @throws IllegalArgumentException if amount is negative
     */
    public static Money of(BigDecimal amount) {
        return of(amount, DEFAULT_CURRENCY);
    }

    /**
     * Creates Money with the specified amount and currency.
     *
     * @param amount   the monetary amount
     * @param currency the currency code
     * @return new Money instance
     * @throws IllegalArgumentException if amount is negative
     */
    public static Money of(BigDecimal amount, String currency) {
        Objects.requireNonNull(amount, "Amount cannot be null");
        if (amount.compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalArgumentException("Amount cannot be negative: " + amount);
        }
        return new Money(amount, currency);
    }

    public static Money zero() {
        return zero(DEFAULT_CURRENCY);
    }

    public static Money zero(String currency) {
        return new Money(BigDecimal.ZERO, currency);
    }

    public Money add(Money other) {
        requireSameCurrency(other);
        return new Money(this.amount.add(other.amount), this.currency);
    }

    /**
     * Subtracts another amount.
     *
     * @throws IllegalArgumentException if the result would be negative or currencies differ
     */
    public Money subtract(Money other) {
        requireSameCurrency(other);
        return of(this.amount.subtract(other.amount), this.currency);
    }

    /**
     * Multiplies this Money by a quantity.
     *
     * @throws IllegalArgumentException if quantity is negative
     */
    public Money multiply(int quantity) {
        if (quantity < 0) {
            throw new IllegalArgumentException("Quantity cannot be negative: " + quantity);
        }
        return new Money(this.amount.multiply(BigDecimal.valueOf(quantity)), this.currency);
    }

    /**
     * Applies a rate such as a tax rate, rounding the result to cents.
     *
     * @throws IllegalArgumentException if rate is negative
     */
    public Money multiply(BigDecimal rate) {
        Objects.requireNonNull(rate, "Rate cannot be null");
        if (rate.signum() < 0) {
            throw new IllegalArgumentException("Rate cannot be negative: " + rate);
        }
        return new Money(this.amount.multiply(rate), this.currency);
    }

    public boolean isGreaterThan(Money other) {
        requireSameCurrency(other);
        return this.amount.compareTo(other.amount) > 0;
    }

    private void requireSameCurrency(Money other) {
        Objects.requireNonNull(other, "Money cannot be null");
        if (!this.currency.equals(other.currency)) {
            throw new IllegalArgumentException(
                    "Currency mismatch: " + this.currency + " vs " + other.currency);
        }
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public String getCurrency() {
        return currency;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Money money = (Money) o;
        return amount.compareTo(money.amount) == 0 && Objects.equals(currency, money.currency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount.stripTrailingZeros(), currency);
    }

    @Override
    public String toString() {
        return amount.toPlainString() + " " + currency;
    }
}
