package com.flagship.vn_accounting.inventory;

import com.flagship.vn_accounting.money.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Cost of goods sold and stock-count reconciliation. Stateless: lots are
 * supplied by the caller and never depleted here.
 *
 * Known limitations, kept for compatibility with existing figures:
 * <ul>
 *   <li>the weighted average is taken over all supplied lots, whatever their product</li>
 *   <li>each demand line draws on the full lots, so two lines for the same
 *       product can cost the same units twice</li>
 *   <li>demand beyond the available quantity is left uncosted, not rejected</li>
 * </ul>
 */
@Service
@Slf4j
public class InventoryCostingService {

    /**
     * @param method null means FIFO
     */
    public CostOfGoodsSold calculateCostOfGoodsSold(List<StockDemand> demands, List<InventoryLot> lots,
                                                    CostingMethod method) {
        CostingMethod costing = method != null ? method : CostingMethod.FIFO;
        if (costing == CostingMethod.WEIGHTED_AVERAGE) {
            return weightedAverage(demands, lots);
        }

        Comparator<InventoryLot> byReceipt = Comparator.comparing(InventoryLot::getReceiptDate);
        Comparator<InventoryLot> order = costing == CostingMethod.LIFO ? byReceipt.reversed() : byReceipt;

        Money total = Money.zero(Money.VND);
        List<CostOfGoodsSold.LineCost> lines = new ArrayList<>();
        for (StockDemand demand : demands) {
            List<InventoryLot> available = lots.stream()
                    .filter(lot -> lot.getProductCode().equals(demand.getProductCode()))
                    .filter(lot -> lot.getRemainingQuantity().signum() > 0)
                    .sorted(order)
                    .toList();

            BigDecimal remaining = demand.getQuantity();
            Money cost = Money.zero(Money.VND);
            for (InventoryLot lot : available) {
                if (remaining.signum() <= 0) {
                    break;
                }
                BigDecimal taken = remaining.min(lot.getRemainingQuantity());
                cost = cost.add(Money.vnd(taken.multiply(lot.getUnitCost())));
                remaining = remaining.subtract(taken);
            }

            BigDecimal costed = demand.getQuantity().subtract(remaining.max(BigDecimal.ZERO));
            if (remaining.signum() > 0) {
                log.warn("Demand for {} exceeds available stock by {} units; shortfall left uncosted",
                        demand.getProductCode(), remaining.toPlainString());
            }
            lines.add(new CostOfGoodsSold.LineCost(demand.getProductCode(), demand.getQuantity(), costed, cost));
            total = total.add(cost);
        }

        log.debug("{} cost of goods sold for {} lines: {}", costing, demands.size(), total);
        return new CostOfGoodsSold(costing, total, null, List.copyOf(lines));
    }

    private CostOfGoodsSold weightedAverage(List<StockDemand> demands, List<InventoryLot> lots) {
        BigDecimal totalQuantity = BigDecimal.ZERO;
        BigDecimal totalValue = BigDecimal.ZERO;
        for (InventoryLot lot : lots) {
            totalQuantity = totalQuantity.add(lot.getRemainingQuantity());
            totalValue = totalValue.add(lot.value());
        }
        BigDecimal averageCost = totalQuantity.signum() > 0
                ? totalValue.divide(totalQuantity, MathContext.DECIMAL128)
                : BigDecimal.ZERO;

        Money total = Money.zero(Money.VND);
        List<CostOfGoodsSold.LineCost> lines = new ArrayList<>();
        for (StockDemand demand : demands) {
            Money cost = Money.vnd(demand.getQuantity().multiply(averageCost));
            lines.add(new CostOfGoodsSold.LineCost(demand.getProductCode(), demand.getQuantity(),
                    demand.getQuantity(), cost));
            total = total.add(cost);
        }

        log.debug("Weighted average cost {} over {} lots: total {}", averageCost.toPlainString(), lots.size(), total);
        return new CostOfGoodsSold(CostingMethod.WEIGHTED_AVERAGE, total, averageCost, List.copyOf(lines));
    }

    /**
     * Values the difference between counted and booked quantity.
     */
    public InventoryReconciliation reconcileInventory(String productCode, BigDecimal actualQuantity,
                                                      BigDecimal bookQuantity, Money unitCost) {
        BigDecimal difference = actualQuantity.subtract(bookQuantity);
        int sign = difference.signum();
        if (sign == 0) {
            return new InventoryReconciliation(productCode, actualQuantity, bookQuantity,
                    Money.zero(Money.VND), "");
        }

        Money amount = Money.vnd(difference.abs().multiply(unitCost.getAmount()));
        String account = sign < 0 ? InventoryReconciliation.SHORTAGE_ACCOUNT : InventoryReconciliation.SURPLUS_ACCOUNT;
        log.info("Stock count for {}: {} {} units, {} to account {}",
                productCode, sign < 0 ? "shortage of" : "surplus of", difference.abs().toPlainString(), amount, account);
        return new InventoryReconciliation(productCode, actualQuantity, bookQuantity, amount, account);
    }
}
