package com.flagship.vn_accounting.money;

import com.flagship.vn_accounting.account.AccountType;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Foreign currency conversion and revaluation (Article 31).
 *
 * Gains go to 4131, losses (and a zero difference) to 4132.
 */
@Service
public class ExchangeRateService {

    static final String GAIN_ACCOUNT = "4131";
    static final String LOSS_ACCOUNT = "4132";

    /**
     * Converts a foreign amount to VND.
     *
     * @throws IllegalArgumentException if the rate is quoted for another currency
     */
    public Money convertToVnd(Money foreignAmount, ExchangeRate rate) {
        if (foreignAmount == null || rate == null) {
            throw new IllegalArgumentException("Amount and exchange rate are required");
        }
        if (!foreignAmount.getCurrency().equals(rate.getCurrency())) {
            throw new IllegalArgumentException(String.format(
                "Exchange rate is quoted for %s but amount is in %s",
                rate.getCurrency(), foreignAmount.getCurrency()));
        }
        return rate.toVnd(foreignAmount.getAmount());
    }

    /**
     * Revaluation difference in VND: amount x (current rate - original rate).
     */
    public Money calculateExchangeDifference(ExchangeRate originalRate, ExchangeRate currentRate, BigDecimal amount) {
        Money originalVnd = originalRate.toVnd(amount);
        Money currentVnd = currentRate.toVnd(amount);
        return currentVnd.subtract(originalVnd);
    }

    public ExchangeDifference classifyExchangeDifference(Money difference) {
        if (difference.getAmount().signum() > 0) {
            return new ExchangeDifference(difference, GAIN_ACCOUNT, AccountType.REVENUE);
        }
        return new ExchangeDifference(difference, LOSS_ACCOUNT, AccountType.EXPENSE);
    }
}
