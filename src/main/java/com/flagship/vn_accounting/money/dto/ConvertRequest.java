package com.flagship.vn_accounting.money.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vn_accounting.money.ExchangeRateType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class ConvertRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @NotNull(message = "Rate is required")
    @DecimalMin(value = "0", inclusive = false, message = "Rate must be greater than 0")
    @JsonProperty("rate")
    BigDecimal rate;

    @JsonProperty("rate_type")
    ExchangeRateType rateType;

    @JsonProperty("valuation_date")
    LocalDate valuationDate;
}
