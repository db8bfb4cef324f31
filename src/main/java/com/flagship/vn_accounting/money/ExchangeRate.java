package com.flagship.vn_accounting.money;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Conversion rate from a foreign currency to VND.
 */
@Value
public class ExchangeRate {
    BigDecimal rate;
    String currency;
    ExchangeRateType rateType;
    LocalDate valuationDate;

    public ExchangeRate(BigDecimal rate, String currency, ExchangeRateType rateType, LocalDate valuationDate) {
        this.rate = Objects.requireNonNull(rate, "rate");
        this.currency = Objects.requireNonNull(currency, "currency");
        this.rateType = rateType != null ? rateType : ExchangeRateType.REALTIME;
        this.valuationDate = valuationDate;
    }

    public static ExchangeRate realtime(BigDecimal rate, String currency) {
        return new ExchangeRate(rate, currency, ExchangeRateType.REALTIME, null);
    }

    /**
     * Converts a foreign amount to VND. No currency check is made here.
     */
    public Money toVnd(BigDecimal amount) {
        return Money.vnd(amount.multiply(rate));
    }
}
