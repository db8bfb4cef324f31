package com.flagship.vn_accounting.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vn_accounting.inventory.InventoryReconciliation;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class InventoryReconciliationResponse {

    @JsonProperty("product_code")
    String productCode;

    @JsonProperty("difference")
    BigDecimal difference;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("account_code")
    String accountCode;

    public static InventoryReconciliationResponse from(InventoryReconciliation result) {
        return new InventoryReconciliationResponse(result.getProductCode(), result.getDifference(),
                result.getAmount().getAmount(), result.getAccountCode());
    }
}
