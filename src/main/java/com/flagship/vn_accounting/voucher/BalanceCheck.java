package com.flagship.vn_accounting.voucher;

import com.flagship.vn_accounting.journal.JournalEntry;
import com.flagship.vn_accounting.money.Money;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Debit/credit totals over all journal entries of a voucher, with one error
 * line per unbalanced entry.
 */
@Value
public class BalanceCheck {
    UUID voucherId;
    String voucherNumber;
    Money totalDebit;
    Money totalCredit;
    Money difference;
    List<String> errors;

    public boolean isBalanced() {
        return errors.isEmpty() && totalDebit.isSameAmountAs(totalCredit);
    }

    public static BalanceCheck of(AccountingVoucher voucher, List<JournalEntry> entries) {
        Money debit = Money.zero(Money.VND);
        Money credit = Money.zero(Money.VND);
        List<String> errors = new ArrayList<>();
        for (JournalEntry entry : entries) {
            debit = debit.add(entry.getTotalDebit());
            credit = credit.add(entry.getTotalCredit());
            if (!entry.isBalanced()) {
                errors.add(String.format("Entry %s: total debit (%s) != total credit (%s)",
                        entry.getEntryNumber(),
                        entry.getTotalDebit().getAmount().toPlainString(),
                        entry.getTotalCredit().getAmount().toPlainString()));
            }
        }
        return new BalanceCheck(voucher.getId(), voucher.getVoucherNumber(),
                debit, credit, debit.subtract(credit), List.copyOf(errors));
    }
}
