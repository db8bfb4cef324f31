package com.flagship.vn_accounting.period.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vn_accounting.period.PeriodLockResult;
import lombok.Value;

@Value
public class PeriodLockResponse {

    @JsonProperty("period")
    FiscalPeriodResponse period;

    @JsonProperty("vouchers_locked")
    int vouchersLocked;

    @JsonProperty("entries_locked")
    int entriesLocked;

    @JsonProperty("already_locked")
    boolean alreadyLocked;

    public static PeriodLockResponse from(PeriodLockResult result) {
        return new PeriodLockResponse(
            FiscalPeriodResponse.from(result.getPeriod()),
            result.getVouchersLocked(),
            result.getEntriesLocked(),
            result.isAlreadyLocked()
        );
    }
}
