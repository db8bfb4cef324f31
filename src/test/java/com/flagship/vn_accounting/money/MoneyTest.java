package com.flagship.vn_accounting.money;

import com.flagship.vn_accounting.account.AccountType;
import com.flagship.vn_accounting.exception.CurrencyMismatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class MoneyTest {

    private final ExchangeRateService exchangeRateService = new ExchangeRateService();

    @Test
    @DisplayName("Adding and subtracting in the same currency keeps the currency")
    void testArithmetic_SameCurrency() {
        Money a = Money.vnd("1000000.50");
        Money b = Money.vnd("250000.25");

        assertEquals(new BigDecimal("1250000.75"), a.add(b).getAmount());
        assertEquals(new BigDecimal("750000.25"), a.subtract(b).getAmount());
        assertEquals(Money.VND, a.add(b).getCurrency());
    }

    @Test
    @DisplayName("Decimal arithmetic does not drift like binary floats")
    void testArithmetic_NoFloatingPointDrift() {
        Money sum = Money.of("0.1", "USD").add(Money.of("0.2", "USD"));
        assertEquals(0, new BigDecimal("0.3").compareTo(sum.getAmount()));
    }

    @Test
    @DisplayName("Mixing currencies fails with CurrencyMismatchException")
    void testArithmetic_CurrencyMismatch() {
        Money vnd = Money.vnd("100");
        Money usd = Money.of("100", "USD");

        CurrencyMismatchException e = assertThrows(CurrencyMismatchException.class, () -> vnd.add(usd));
        assertEquals("CURRENCY_MISMATCH", e.getErrorCode());
        assertEquals("VND", e.getLeftCurrency());
        assertEquals("USD", e.getRightCurrency());
        assertThrows(CurrencyMismatchException.class, () -> vnd.subtract(usd));
    }

    @Test
    @DisplayName("Operations return new values and leave the original untouched")
    void testImmutability() {
        Money original = Money.vnd("500");
        Money result = original.add(Money.vnd("100"));

        assertNotSame(original, result);
        assertEquals(new BigDecimal("500"), original.getAmount());
    }

    @Test
    @DisplayName("Negative amounts are allowed")
    void testNegativeAmounts() {
        Money negative = Money.vnd("100").subtract(Money.vnd("300"));
        assertTrue(negative.isNegative());
        assertEquals(new BigDecimal("-200"), negative.getAmount());
    }

    @Test
    @DisplayName("Same amount ignores scale")
    void testIsSameAmountAs_IgnoresScale() {
        assertTrue(Money.vnd("100.00").isSameAmountAs(Money.vnd("100")));
        assertFalse(Money.vnd("100").isSameAmountAs(Money.of("100", "USD")));
    }

    @Test
    @DisplayName("ExchangeRate.toVnd multiplies without a currency check")
    void testExchangeRate_ToVnd() {
        ExchangeRate rate = ExchangeRate.realtime(new BigDecimal("25000"), "USD");

        Money vnd = rate.toVnd(new BigDecimal("100"));

        assertEquals(Money.VND, vnd.getCurrency());
        assertEquals(0, new BigDecimal("2500000").compareTo(vnd.getAmount()));
        assertEquals(ExchangeRateType.REALTIME, rate.getRateType());
    }

    @Test
    @DisplayName("convertToVnd rejects a rate quoted for another currency")
    void testConvertToVnd_RateCurrencyMismatch() {
        ExchangeRate eurRate = ExchangeRate.realtime(new BigDecimal("27000"), "EUR");

        assertThrows(IllegalArgumentException.class,
                () -> exchangeRateService.convertToVnd(Money.of("10", "USD"), eurRate));

        Money converted = exchangeRateService.convertToVnd(Money.of("10", "EUR"), eurRate);
        assertEquals(0, new BigDecimal("270000").compareTo(converted.getAmount()));
    }

    @Test
    @DisplayName("Exchange difference is amount x (current - original) and classified by sign")
    void testExchangeDifference() {
        ExchangeRate original = ExchangeRate.realtime(new BigDecimal("24000"), "USD");
        ExchangeRate higher = ExchangeRate.realtime(new BigDecimal("24500"), "USD");
        ExchangeRate lower = ExchangeRate.realtime(new BigDecimal("23800"), "USD");

        Money gain = exchangeRateService.calculateExchangeDifference(original, higher, new BigDecimal("1000"));
        Money loss = exchangeRateService.calculateExchangeDifference(original, lower, new BigDecimal("1000"));

        assertEquals(0, new BigDecimal("500000").compareTo(gain.getAmount()));
        assertEquals(0, new BigDecimal("-200000").compareTo(loss.getAmount()));

        ExchangeDifference gainClass = exchangeRateService.classifyExchangeDifference(gain);
        assertEquals("4131", gainClass.getAccountCode());
        assertEquals(AccountType.REVENUE, gainClass.getAccountType());

        ExchangeDifference lossClass = exchangeRateService.classifyExchangeDifference(loss);
        assertEquals("4132", lossClass.getAccountCode());
        assertEquals(AccountType.EXPENSE, lossClass.getAccountType());
    }

    @Test
    @DisplayName("A zero exchange difference is booked as a loss")
    void testExchangeDifference_ZeroGoesToLossAccount() {
        ExchangeDifference zero = exchangeRateService.classifyExchangeDifference(Money.zero(Money.VND));
        assertEquals("4132", zero.getAccountCode());
    }
}
