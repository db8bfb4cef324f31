package com.flagship.vn_accounting.inventory;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Quantity still on hand from one receipt, at its VND unit cost.
 */
@Value
public class InventoryLot {
    String productCode;
    BigDecimal remainingQuantity;
    BigDecimal unitCost;
    LocalDate receiptDate;

    public BigDecimal value() {
        return remainingQuantity.multiply(unitCost);
    }
}
