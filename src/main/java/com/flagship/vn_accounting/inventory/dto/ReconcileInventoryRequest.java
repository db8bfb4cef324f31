package com.flagship.vn_accounting.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class ReconcileInventoryRequest {

    @NotBlank(message = "Product code is required")
    @JsonProperty("product_code")
    String productCode;

    @NotNull(message = "Actual quantity is required")
    @DecimalMin(value = "0", message = "Actual quantity cannot be negative")
    @JsonProperty("actual_quantity")
    BigDecimal actualQuantity;

    @NotNull(message = "Book quantity is required")
    @DecimalMin(value = "0", message = "Book quantity cannot be negative")
    @JsonProperty("book_quantity")
    BigDecimal bookQuantity;

    @NotNull(message = "Unit cost is required")
    @DecimalMin(value = "0", message = "Unit cost cannot be negative")
    @JsonProperty("unit_cost")
    BigDecimal unitCost;
}
