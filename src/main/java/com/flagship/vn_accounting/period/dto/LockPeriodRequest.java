package com.flagship.vn_accounting.period.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vn_accounting.period.PeriodType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * {@code period_value} is the month (1-12) or quarter (1-4); omitted for YEAR.
 */
@Value
public class LockPeriodRequest {

    @NotNull(message = "Period type is required")
    @JsonProperty("period_type")
    PeriodType periodType;

    @Min(value = 2000, message = "Year must be 2000 or later")
    @Max(value = 2100, message = "Year must be 2100 or earlier")
    @JsonProperty("year")
    int year;

    @JsonProperty("period_value")
    Integer periodValue;
}
