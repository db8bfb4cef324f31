package com.flagship.vn_accounting.account;

import com.flagship.vn_accounting.money.Money;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Chart-of-accounts node.
 *
 * Immutable: posting returns a new Account with an updated balance and version.
 * The balance direction is fixed at creation and never changed by posting.
 * Parent codes form a tree; cycles are not detected here.
 */
@Value
@Builder(toBuilder = true)
public class Account {
    UUID id;
    String code;
    String name;
    AccountType accountType;
    String companyCode;
    String parentCode;
    boolean detail;
    boolean active;
    boolean system;
    Money openingBalanceDebit;
    Money openingBalanceCredit;
    Money currentBalance;
    BalanceDirection balanceDirection;
    String currency;
    long version;

    /**
     * Creates an active account whose balance direction follows its type.
     */
    public static Account create(String code, String name, AccountType accountType, String companyCode) {
        return create(code, name, accountType, companyCode, accountType.getNormalBalance());
    }

    public static Account create(String code, String name, AccountType accountType,
                                 String companyCode, BalanceDirection balanceDirection) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Account code is required");
        }
        if (accountType == null || balanceDirection == null) {
            throw new IllegalArgumentException("Account type and balance direction are required");
        }
        return Account.builder()
                .id(UUID.randomUUID())
                .code(code)
                .name(name)
                .accountType(accountType)
                .companyCode(companyCode)
                .active(true)
                .currentBalance(Money.zero(Money.VND))
                .balanceDirection(balanceDirection)
                .currency(Money.VND)
                .version(1)
                .build();
    }

    /**
     * Applies a posting to the current balance.
     *
     * DEBIT accounts: balance + debit - credit.
     * CREDIT accounts: balance - debit + credit.
     * Negative results are allowed; see {@link AccountBalance#checkNegativeBalance()}.
     *
     * @return New Account with the updated balance and version + 1
     */
    public Account postBalance(Money debit, Money credit) {
        Money balance = currentBalance != null ? currentBalance : Money.zero(currency);
        Money newBalance = balanceDirection == BalanceDirection.DEBIT
                ? balance.add(debit).subtract(credit)
                : balance.subtract(debit).add(credit);
        return toBuilder()
                .currentBalance(newBalance)
                .version(version + 1)
                .build();
    }

    /**
     * An opening balance should sit on one side only.
     */
    public boolean hasOpeningBalanceOnBothSides() {
        return openingBalanceDebit != null && openingBalanceCredit != null;
    }

    public boolean hasNegativeBalance() {
        return currentBalance != null && currentBalance.isNegative();
    }
}
