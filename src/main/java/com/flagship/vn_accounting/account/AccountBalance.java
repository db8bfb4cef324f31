package com.flagship.vn_accounting.account;

import com.flagship.vn_accounting.money.Money;
import com.flagship.vn_accounting.period.PeriodType;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-period balance snapshot of one account.
 * Only used for advisory checks, never for posting.
 */
@Value
@Builder
public class AccountBalance {
    String accountCode;
    String companyCode;
    PeriodType periodType;
    int year;
    int periodValue;
    Money openingDebit;
    Money openingCredit;
    Money periodDebit;
    Money periodCredit;
    Money closingDebit;
    Money closingCredit;

    /**
     * Warns when the closing debit balance is negative. Never blocks.
     */
    public List<String> checkNegativeBalance() {
        List<String> warnings = new ArrayList<>();
        if (closingDebit != null && closingDebit.isNegative()) {
            warnings.add(String.format("Account %s: closing balance is negative (%s)",
                    accountCode, closingDebit.getAmount().toPlainString()));
        }
        return warnings;
    }
}
