package com.flagship.vn_accounting.exception;

import java.math.BigDecimal;

/**
 * Thrown when a journal entry's debits don't equal its credits.
 */
public class JournalEntryNotBalancedException extends AccountingException {

    private final String entryNumber;
    private final BigDecimal totalDebit;
    private final BigDecimal totalCredit;
    private final BigDecimal difference;

    public JournalEntryNotBalancedException(String entryNumber, BigDecimal totalDebit, BigDecimal totalCredit) {
        super("JOURNAL_NOT_BALANCED",
                String.format("Journal entry %s is not balanced: debit=%s, credit=%s, difference=%s",
                        entryNumber, plain(totalDebit), plain(totalCredit), plain(difference(totalDebit, totalCredit))));
        this.entryNumber = entryNumber;
        this.totalDebit = totalDebit;
        this.totalCredit = totalCredit;
        this.difference = difference(totalDebit, totalCredit);
    }

    private static BigDecimal difference(BigDecimal debit, BigDecimal credit) {
        if (debit == null || credit == null) {
            return null;
        }
        return debit.subtract(credit);
    }

    private static String plain(BigDecimal value) {
        return value != null ? value.toPlainString() : "n/a";
    }

    public String getEntryNumber() {
        return entryNumber;
    }

    public BigDecimal getTotalDebit() {
        return totalDebit;
    }

    public BigDecimal getTotalCredit() {
        return totalCredit;
    }

    public BigDecimal getDifference() {
        return difference;
    }
}
