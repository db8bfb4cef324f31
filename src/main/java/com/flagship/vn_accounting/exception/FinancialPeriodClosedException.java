package com.flagship.vn_accounting.exception;

import java.time.LocalDate;

/**
 * Thrown when a voucher or entry date falls in a locked fiscal period.
 */
public class FinancialPeriodClosedException extends AccountingException {

    private final LocalDate date;
    private final String periodName;

    public FinancialPeriodClosedException(LocalDate date, String periodName) {
        super("PERIOD_CLOSED",
                String.format("Fiscal period %s is locked; no changes allowed for %s", periodName, date));
        this.date = date;
        this.periodName = periodName;
    }

    public LocalDate getDate() {
        return date;
    }

    public String getPeriodName() {
        return periodName;
    }
}
