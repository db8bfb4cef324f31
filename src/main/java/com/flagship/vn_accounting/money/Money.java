package com.flagship.vn_accounting.money;

import com.flagship.vn_accounting.exception.CurrencyMismatchException;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Exact decimal amount tagged with a currency code.
 *
 * Immutable: every operation returns a new Money.
 * Negative amounts are allowed (reversing entries, contra accounts).
 * Arithmetic between two Money values requires the same currency.
 */
@Value
public class Money {

    public static final String VND = "VND";

    BigDecimal amount;
    String currency;

    private Money(BigDecimal amount, String currency) {
        this.amount = Objects.requireNonNull(amount, "amount");
        this.currency = Objects.requireNonNull(currency, "currency");
    }

    public static Money of(BigDecimal amount, String currency) {
        return new Money(amount, currency);
    }

    public static Money of(String amount, String currency) {
        return new Money(new BigDecimal(amount), currency);
    }

    public static Money vnd(BigDecimal amount) {
        return new Money(amount, VND);
    }

    public static Money vnd(String amount) {
        return new Money(new BigDecimal(amount), VND);
    }

    public static Money zero(String currency) {
        return new Money(BigDecimal.ZERO, currency);
    }

    /**
     * @throws CurrencyMismatchException if currencies differ
     */
    public Money add(Money other) {
        requireSameCurrency(other, "add");
        return new Money(amount.add(other.amount), currency);
    }

    /**
     * @throws CurrencyMismatchException if currencies differ
     */
    public Money subtract(Money other) {
        requireSameCurrency(other, "subtract");
        return new Money(amount.subtract(other.amount), currency);
    }

    public Money multiply(BigDecimal factor) {
        return new Money(amount.multiply(factor), currency);
    }

    public Money negate() {
        return new Money(amount.negate(), currency);
    }

    public boolean isNegative() {
        return amount.signum() < 0;
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    /**
     * Numeric equality, ignoring scale (100.00 equals 100).
     */
    public boolean isSameAmountAs(Money other) {
        return currency.equals(other.currency) && amount.compareTo(other.amount) == 0;
    }

    private void requireSameCurrency(Money other, String operation) {
        Objects.requireNonNull(other, "other");
        if (!currency.equals(other.currency)) {
            throw new CurrencyMismatchException(operation, currency, other.currency);
        }
    }

    @Override
    public String toString() {
        return amount.toPlainString() + " " + currency;
    }
}
