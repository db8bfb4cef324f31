package com.flagship.vn_accounting.period;

import lombok.Value;

@Value
public class PeriodLockResult {
    FiscalPeriod period;
    int vouchersLocked;
    int entriesLocked;
    boolean alreadyLocked;
}
