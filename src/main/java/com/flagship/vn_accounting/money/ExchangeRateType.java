package com.flagship.vn_accounting.money;

/**
 * Classification of an exchange rate (Article 31).
 */
public enum ExchangeRateType {
    /** Actual transaction rate on the transaction date. */
    REALTIME,
    /** Period-average rate. */
    AVERAGE
}
