package com.flagship.vn_accounting.provision.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vn_accounting.provision.ReceivableItem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class SpecificProvisionRequest {

    @NotEmpty(message = "At least one receivable is required")
    @Valid
    @JsonProperty("receivables")
    List<Receivable> receivables;

    @Value
    public static class Receivable {
        @JsonProperty("customer_code")
        String customerCode;

        @NotNull(message = "Amount is required")
        @DecimalMin(value = "0", message = "Amount cannot be negative")
        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("overdue_days")
        int overdueDays;

        public ReceivableItem toDomain() {
            return new ReceivableItem(customerCode, amount, overdueDays);
        }
    }
}
