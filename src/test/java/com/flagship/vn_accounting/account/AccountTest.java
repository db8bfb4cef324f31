package com.flagship.vn_accounting.account;

import com.flagship.vn_accounting.money.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class AccountTest {

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private Account withBalance(Account account, String balance) {
        return account.toBuilder().currentBalance(Money.vnd(balance)).build();
    }

    @Test
    @DisplayName("Balance direction follows the account type")
    void testCreate_DirectionFromType() {
        assertEquals(BalanceDirection.DEBIT, Account.create("111", "Cash", AccountType.ASSET, "DEMO").getBalanceDirection());
        assertEquals(BalanceDirection.DEBIT, Account.create("632", "COGS", AccountType.DIRECT_COST, "DEMO").getBalanceDirection());
        assertEquals(BalanceDirection.DEBIT, Account.create("811", "Other", AccountType.OTHER_EXPENSE, "DEMO").getBalanceDirection());
        assertEquals(BalanceDirection.CREDIT, Account.create("331", "Payable", AccountType.LIABILITY, "DEMO").getBalanceDirection());
        assertEquals(BalanceDirection.CREDIT, Account.create("511", "Revenue", AccountType.REVENUE, "DEMO").getBalanceDirection());
        assertEquals(BalanceDirection.CREDIT, Account.create("711", "Other income", AccountType.OTHER_REVENUE, "DEMO").getBalanceDirection());
    }

    @Test
    @DisplayName("Contra accounts can override the direction")
    void testCreate_ExplicitDirection() {
        Account depreciation = Account.create("214", "Depreciation", AccountType.ASSET, "DEMO", BalanceDirection.CREDIT);
        assertEquals(BalanceDirection.CREDIT, depreciation.getBalanceDirection());
    }

    @Test
    @DisplayName("DEBIT account: balance + debit - credit")
    void testPostBalance_DebitAccount() {
        printTestHeader("Posting to a DEBIT account");
        Account cash = withBalance(Account.create("111", "Cash", AccountType.ASSET, "DEMO"), "10000000");

        Account afterDebit = cash.postBalance(Money.vnd("5000000"), Money.vnd("0"));
        Account afterCredit = cash.postBalance(Money.vnd("0"), Money.vnd("3000000"));

        assertEquals(0, new BigDecimal("15000000").compareTo(afterDebit.getCurrentBalance().getAmount()));
        assertEquals(0, new BigDecimal("7000000").compareTo(afterCredit.getCurrentBalance().getAmount()));
        assertEquals(cash.getVersion() + 1, afterDebit.getVersion());
        assertEquals(BalanceDirection.DEBIT, afterDebit.getBalanceDirection());
    }

    @Test
    @DisplayName("CREDIT account: balance - debit + credit")
    void testPostBalance_CreditAccount() {
        Account payable = withBalance(Account.create("331", "Payable", AccountType.LIABILITY, "DEMO"), "5000000");

        Account after = payable.postBalance(Money.vnd("0"), Money.vnd("2000000"));

        assertEquals(0, new BigDecimal("7000000").compareTo(after.getCurrentBalance().getAmount()));
        assertEquals(BalanceDirection.CREDIT, after.getBalanceDirection());
    }

    @Test
    @DisplayName("Posting may drive a balance negative; it is flagged, not rejected")
    void testPostBalance_NegativeAllowed() {
        Account cash = withBalance(Account.create("111", "Cash", AccountType.ASSET, "DEMO"), "100");

        Account after = cash.postBalance(Money.vnd("0"), Money.vnd("300"));

        assertTrue(after.hasNegativeBalance());
        assertFalse(cash.hasNegativeBalance());
    }

    @Test
    @DisplayName("Opening balances on both sides are detected")
    void testOpeningBalanceOnBothSides() {
        Account account = Account.create("131", "Receivable", AccountType.ASSET, "DEMO").toBuilder()
                .openingBalanceDebit(Money.vnd("100"))
                .openingBalanceCredit(Money.vnd("50"))
                .build();
        assertTrue(account.hasOpeningBalanceOnBothSides());
    }

    @Test
    @DisplayName("Negative-balance warning only fires on a negative closing debit")
    void testCheckNegativeBalance() {
        AccountBalance negative = AccountBalance.builder().accountCode("111").closingDebit(Money.vnd("-1")).build();
        AccountBalance positive = AccountBalance.builder().accountCode("111").closingDebit(Money.vnd("1")).build();
        AccountBalance absent = AccountBalance.builder().accountCode("111").closingCredit(Money.vnd("-5")).build();

        assertEquals(1, negative.checkNegativeBalance().size());
        assertTrue(negative.checkNegativeBalance().get(0).contains("111"));
        assertTrue(positive.checkNegativeBalance().isEmpty());
        assertTrue(absent.checkNegativeBalance().isEmpty());
    }
}
