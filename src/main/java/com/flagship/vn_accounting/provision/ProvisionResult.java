package com.flagship.vn_accounting.provision;

import com.flagship.vn_accounting.money.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class ProvisionResult {
    Money totalProvision;
    List<ItemProvision> items;

    @Value
    public static class ItemProvision {
        ReceivableItem receivable;
        /** Null when no band applies. */
        ProvisionBand band;
        BigDecimal rate;
        Money provision;
    }
}
