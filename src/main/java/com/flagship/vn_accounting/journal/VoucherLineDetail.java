package com.flagship.vn_accounting.journal;

import com.flagship.vn_accounting.money.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One line of a journal entry.
 *
 * A line conventionally carries either a debit or a credit amount, not both.
 * Corrections rebuild the line instead of mutating it.
 */
@Value
@Builder(toBuilder = true)
public class VoucherLineDetail {
    String accountCode;
    Money debitAmount;
    Money creditAmount;
    String counterpartAccount;
    String description;

    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal exchangeRate;
    Money foreignAmount;

    String taxCode;
    BigDecimal taxRate;

    /** Customer, supplier, goods or contract code. */
    String objectCode;
    String objectType;
    String contractCode;

    public static VoucherLineDetail debit(String accountCode, Money amount) {
        return VoucherLineDetail.builder().accountCode(accountCode).debitAmount(amount).build();
    }

    public static VoucherLineDetail credit(String accountCode, Money amount) {
        return VoucherLineDetail.builder().accountCode(accountCode).creditAmount(amount).build();
    }
}
