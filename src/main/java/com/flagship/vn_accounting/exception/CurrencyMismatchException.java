package com.flagship.vn_accounting.exception;

/**
 * Thrown when Money arithmetic mixes two currencies.
 * Callers must convert first.
 */
public class CurrencyMismatchException extends AccountingException {

    private final String leftCurrency;
    private final String rightCurrency;

    public CurrencyMismatchException(String operation, String leftCurrency, String rightCurrency) {
        super("CURRENCY_MISMATCH",
                String.format("Cannot %s amounts in different currencies: %s and %s",
                        operation, leftCurrency, rightCurrency));
        this.leftCurrency = leftCurrency;
        this.rightCurrency = rightCurrency;
    }

    public String getLeftCurrency() {
        return leftCurrency;
    }

    public String getRightCurrency() {
        return rightCurrency;
    }
}
