package com.flagship.vn_accounting.inventory;

import com.flagship.vn_accounting.money.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Total cost of a set of demand lines, with the per-line breakdown.
 * {@code averageCost} is only set for {@link CostingMethod#WEIGHTED_AVERAGE}.
 */
@Value
public class CostOfGoodsSold {
    CostingMethod method;
    Money totalCost;
    BigDecimal averageCost;
    List<LineCost> lines;

    @Value
    public static class LineCost {
        String productCode;
        BigDecimal requestedQuantity;
        BigDecimal costedQuantity;
        Money cost;

        /** Requested units no lot could cover. */
        public BigDecimal getShortfall() {
            return requestedQuantity.subtract(costedQuantity);
        }
    }
}
