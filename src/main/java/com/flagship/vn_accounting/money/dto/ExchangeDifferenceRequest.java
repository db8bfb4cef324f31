package com.flagship.vn_accounting.money.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Revaluation of a foreign-currency balance from its booking rate to the
 * current rate.
 */
@Value
public class ExchangeDifferenceRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @NotNull(message = "Original rate is required")
    @DecimalMin(value = "0", inclusive = false, message = "Original rate must be greater than 0")
    @JsonProperty("original_rate")
    BigDecimal originalRate;

    @NotNull(message = "Current rate is required")
    @DecimalMin(value = "0", inclusive = false, message = "Current rate must be greater than 0")
    @JsonProperty("current_rate")
    BigDecimal currentRate;
}
