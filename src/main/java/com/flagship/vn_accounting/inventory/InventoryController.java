package com.flagship.vn_accounting.inventory;

import com.flagship.vn_accounting.inventory.dto.CostOfGoodsSoldRequest;
import com.flagship.vn_accounting.inventory.dto.CostOfGoodsSoldResponse;
import com.flagship.vn_accounting.inventory.dto.InventoryReconciliationResponse;
import com.flagship.vn_accounting.inventory.dto.ReconcileInventoryRequest;
import com.flagship.vn_accounting.money.Money;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Calculators used when building stock-related journal lines. Nothing is persisted.
 */
@RestController
@RequestMapping("/api/v1/inventory")
@RequiredArgsConstructor
public class InventoryController {

    private final InventoryCostingService costingService;

    @PostMapping("/cost-of-goods-sold")
    public CostOfGoodsSoldResponse costOfGoodsSold(@Valid @RequestBody CostOfGoodsSoldRequest request) {
        CostOfGoodsSold result = costingService.calculateCostOfGoodsSold(
            request.getGoods().stream().map(CostOfGoodsSoldRequest.Demand::toDomain).toList(),
            request.getInventory().stream().map(CostOfGoodsSoldRequest.Lot::toDomain).toList(),
            request.getMethod());
        return CostOfGoodsSoldResponse.from(result);
    }

    @PostMapping("/reconcile")
    public InventoryReconciliationResponse reconcile(@Valid @RequestBody ReconcileInventoryRequest request) {
        return InventoryReconciliationResponse.from(costingService.reconcileInventory(
            request.getProductCode(),
            request.getActualQuantity(),
            request.getBookQuantity(),
            Money.vnd(request.getUnitCost())));
    }
}
