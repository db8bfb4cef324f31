package com.flagship.vn_accounting.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vn_accounting.inventory.CostingMethod;
import com.flagship.vn_accounting.inventory.InventoryLot;
import com.flagship.vn_accounting.inventory.StockDemand;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * {@code method} defaults to FIFO.
 */
@Value
public class CostOfGoodsSoldRequest {

    @JsonProperty("method")
    CostingMethod method;

    @NotEmpty(message = "At least one demand line is required")
    @Valid
    @JsonProperty("goods")
    List<Demand> goods;

    @NotNull(message = "Inventory lots are required")
    @Valid
    @JsonProperty("inventory")
    List<Lot> inventory;

    @Value
    public static class Demand {
        @NotBlank(message = "Product code is required")
        @JsonProperty("product_code")
        String productCode;

        @NotNull(message = "Quantity is required")
        @DecimalMin(value = "0", message = "Quantity cannot be negative")
        @JsonProperty("quantity")
        BigDecimal quantity;

        public StockDemand toDomain() {
            return new StockDemand(productCode, quantity);
        }
    }

    @Value
    public static class Lot {
        @NotBlank(message = "Product code is required")
        @JsonProperty("product_code")
        String productCode;

        @NotNull(message = "Remaining quantity is required")
        @DecimalMin(value = "0", message = "Remaining quantity cannot be negative")
        @JsonProperty("remaining_qty")
        BigDecimal remainingQuantity;

        @NotNull(message = "Unit cost is required")
        @DecimalMin(value = "0", message = "Unit cost cannot be negative")
        @JsonProperty("unit_cost")
        BigDecimal unitCost;

        @NotNull(message = "Receipt date is required")
        @JsonProperty("receipt_date")
        LocalDate receiptDate;

        public InventoryLot toDomain() {
            return new InventoryLot(productCode, remainingQuantity, unitCost, receiptDate);
        }
    }
}
