package com.flagship.vn_accounting.period;

/**
 * Book-closing status (Articles 18-22, Appendix III).
 *
 * Anything other than OPEN freezes the voucher, entry or period.
 */
public enum LockStatus {
    /** Editable. */
    OPEN,
    MONTH_LOCKED,
    QUARTER_LOCKED,
    YEAR_LOCKED,
    /** Year-end settlement finalized. */
    FINALIZED,
    /** Locked individually from the voucher endpoint. */
    MANUAL;

    public static LockStatus forPeriod(PeriodType periodType) {
        return switch (periodType) {
            case MONTH -> MONTH_LOCKED;
            case QUARTER -> QUARTER_LOCKED;
            case YEAR -> YEAR_LOCKED;
        };
    }
}
