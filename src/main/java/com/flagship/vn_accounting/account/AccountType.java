package com.flagship.vn_accounting.account;

/**
 * Account classification from Appendix II of Circular 99/2025.
 *
 * The first digit of the account code usually identifies the class.
 */
public enum AccountType {
    ASSET(BalanceDirection.DEBIT),          // 1xx, 2xx
    LIABILITY(BalanceDirection.CREDIT),     // 3xx
    EQUITY(BalanceDirection.CREDIT),        // 4xx
    REVENUE(BalanceDirection.CREDIT),       // 5xx
    EXPENSE(BalanceDirection.DEBIT),        // 6xx
    DIRECT_COST(BalanceDirection.DEBIT),    // 632 and production costs
    OTHER_REVENUE(BalanceDirection.CREDIT), // 7xx
    OTHER_EXPENSE(BalanceDirection.DEBIT);  // 8xx

    private final BalanceDirection normalBalance;

    AccountType(BalanceDirection normalBalance) {
        this.normalBalance = normalBalance;
    }

    /**
     * Direction used when an account is created without an explicit one.
     * Contra accounts (e.g. 214 accumulated depreciation) override it.
     */
    public BalanceDirection getNormalBalance() {
        return normalBalance;
    }
}
