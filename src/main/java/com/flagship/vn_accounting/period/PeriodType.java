package com.flagship.vn_accounting.period;

public enum PeriodType {
    MONTH,
    QUARTER,
    YEAR
}
