package com.flagship.vn_accounting.account;

/**
 * The side on which an account's balance normally increases.
 */
public enum BalanceDirection {
    DEBIT,
    CREDIT
}
