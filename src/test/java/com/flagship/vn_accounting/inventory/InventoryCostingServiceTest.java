package com.flagship.vn_accounting.inventory;

import com.flagship.vn_accounting.money.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InventoryCostingServiceTest {

    private final InventoryCostingService service = new InventoryCostingService();

    // Listed newest first so ordering comes from the receipt date
    private final List<InventoryLot> lots = List.of(
        new InventoryLot("SP001", new BigDecimal("40"), new BigDecimal("110000"), LocalDate.of(2025, 2, 1)),
        new InventoryLot("SP001", new BigDecimal("30"), new BigDecimal("100000"), LocalDate.of(2025, 1, 1)));

    private final List<StockDemand> demand = List.of(new StockDemand("SP001", new BigDecimal("50")));

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("  " + label + ": " + value);
    }

    @Test
    @DisplayName("FIFO consumes the oldest lots first")
    void testFifo() {
        printTestHeader("FIFO cost of goods sold");

        CostOfGoodsSold result = service.calculateCostOfGoodsSold(demand, lots, CostingMethod.FIFO);
        printOutput("Total", result.getTotalCost());

        assertEquals(0, new BigDecimal("5200000").compareTo(result.getTotalCost().getAmount()));
        assertEquals(CostingMethod.FIFO, result.getMethod());
        assertNull(result.getAverageCost());
        assertEquals(0, result.getLines().get(0).getShortfall().signum());
    }

    @Test
    @DisplayName("LIFO consumes the newest lots first")
    void testLifo() {
        CostOfGoodsSold result = service.calculateCostOfGoodsSold(demand, lots, CostingMethod.LIFO);

        assertEquals(0, new BigDecimal("5400000").compareTo(result.getTotalCost().getAmount()));
    }

    @Test
    @DisplayName("Weighted average uses one average over every lot")
    void testWeightedAverage() {
        printTestHeader("Weighted average cost of goods sold");

        CostOfGoodsSold result = service.calculateCostOfGoodsSold(demand, lots, CostingMethod.WEIGHTED_AVERAGE);
        printOutput("Average", result.getAverageCost());
        printOutput("Total", result.getTotalCost());

        // 7,400,000 / 70 x 50
        BigDecimal expected = new BigDecimal("5285714.29");
        assertTrue(expected.subtract(result.getTotalCost().getAmount()).abs().compareTo(BigDecimal.ONE) < 0);
        assertNotNull(result.getAverageCost());
    }

    @Test
    @DisplayName("FIFO and LIFO agree when every unit is consumed")
    void testFifoLifo_FullConsumption() {
        List<StockDemand> all = List.of(new StockDemand("SP001", new BigDecimal("70")));

        CostOfGoodsSold fifo = service.calculateCostOfGoodsSold(all, lots, CostingMethod.FIFO);
        CostOfGoodsSold lifo = service.calculateCostOfGoodsSold(all, lots, CostingMethod.LIFO);

        assertEquals(0, new BigDecimal("7400000").compareTo(fifo.getTotalCost().getAmount()));
        assertTrue(fifo.getTotalCost().isSameAmountAs(lifo.getTotalCost()));
    }

    @Test
    @DisplayName("A missing costing method falls back to FIFO")
    void testNullMethodIsFifo() {
        CostOfGoodsSold result = service.calculateCostOfGoodsSold(demand, lots, null);

        assertEquals(CostingMethod.FIFO, result.getMethod());
        assertEquals(0, new BigDecimal("5200000").compareTo(result.getTotalCost().getAmount()));
    }

    @Test
    @DisplayName("Demand beyond stock is costed up to what is available")
    void testShortfall() {
        List<StockDemand> big = List.of(new StockDemand("SP001", new BigDecimal("100")));

        CostOfGoodsSold result = service.calculateCostOfGoodsSold(big, lots, CostingMethod.FIFO);

        assertEquals(0, new BigDecimal("7400000").compareTo(result.getTotalCost().getAmount()));
        assertEquals(0, new BigDecimal("30").compareTo(result.getLines().get(0).getShortfall()));
    }

    @Test
    @DisplayName("Lots of other products are ignored")
    void testOtherProductIgnored() {
        List<StockDemand> other = List.of(new StockDemand("SP999", new BigDecimal("10")));

        CostOfGoodsSold result = service.calculateCostOfGoodsSold(other, lots, CostingMethod.FIFO);

        assertTrue(result.getTotalCost().isZero());
    }

    @Test
    @DisplayName("Costing method accepts the short weighted-average alias")
    void testCostingMethodAlias() {
        assertEquals(CostingMethod.WEIGHTED_AVERAGE, CostingMethod.fromValue("weighted_avg"));
        assertEquals(CostingMethod.LIFO, CostingMethod.fromValue("lifo"));
    }

    @Test
    @DisplayName("Count below book is a shortage to 1381")
    void testReconcile_Shortage() {
        InventoryReconciliation result = service.reconcileInventory("SP001",
                new BigDecimal("95"), new BigDecimal("100"), Money.vnd("100000"));

        assertTrue(result.isShortage());
        assertEquals("1381", result.getAccountCode());
        assertEquals(0, new BigDecimal("500000").compareTo(result.getAmount().getAmount()));
    }

    @Test
    @DisplayName("Count above book is a surplus to 3381")
    void testReconcile_Surplus() {
        InventoryReconciliation result = service.reconcileInventory("SP001",
                new BigDecimal("105"), new BigDecimal("100"), Money.vnd("100000"));

        assertTrue(result.isSurplus());
        assertEquals("3381", result.getAccountCode());
        assertEquals(0, new BigDecimal("500000").compareTo(result.getAmount().getAmount()));
    }

    @Test
    @DisplayName("Matching count produces no amount and no account")
    void testReconcile_NoDifference() {
        InventoryReconciliation result = service.reconcileInventory("SP001",
                new BigDecimal("100"), new BigDecimal("100"), Money.vnd("100000"));

        assertFalse(result.isShortage());
        assertFalse(result.isSurplus());
        assertEquals("", result.getAccountCode());
        assertTrue(result.getAmount().isZero());
    }
}
