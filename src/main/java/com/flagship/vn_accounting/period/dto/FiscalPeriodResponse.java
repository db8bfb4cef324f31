package com.flagship.vn_accounting.period.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vn_accounting.period.FiscalPeriod;
import com.flagship.vn_accounting.period.LockStatus;
import com.flagship.vn_accounting.period.PeriodType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class FiscalPeriodResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("period_type")
    PeriodType periodType;

    @JsonProperty("year")
    int year;

    @JsonProperty("period_value")
    int periodValue;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("is_locked")
    boolean locked;

    @JsonProperty("lock_status")
    LockStatus lockStatus;

    @JsonProperty("locked_at")
    Instant lockedAt;

    @JsonProperty("locked_by")
    String lockedBy;

    public static FiscalPeriodResponse from(FiscalPeriod period) {
        return FiscalPeriodResponse.builder()
                .id(period.getId())
                .name(period.getName())
                .periodType(period.getPeriodType())
                .year(period.getYear())
                .periodValue(period.getPeriodValue())
                .startDate(period.getStartDate())
                .endDate(period.getEndDate())
                .locked(period.isLocked())
                .lockStatus(period.getLockStatus())
                .lockedAt(period.getLockedAt())
                .lockedBy(period.getLockedBy())
                .build();
    }
}
