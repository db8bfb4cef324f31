package com.flagship.vn_accounting.provision;

import com.flagship.vn_accounting.money.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProvisionServiceTest {

    private final ProvisionService service = new ProvisionService();

    @ParameterizedTest(name = "{0} days overdue on 10,000,000 -> {1}")
    @CsvSource({
        "30, 0",
        "90, 0",
        "91, 3000000",
        "120, 3000000",
        "200, 5000000",
        "365, 5000000",
        "366, 10000000",
        "400, 10000000"
    })
    @DisplayName("Specific provision rate follows the overdue band")
    void testSpecificProvision_Bands(int overdueDays, String expected) {
        ProvisionResult result = service.calculateSpecificProvision(
            List.of(new ReceivableItem("KH001", new BigDecimal("10000000"), overdueDays)));

        assertEquals(0, new BigDecimal(expected).compareTo(result.getTotalProvision().getAmount()));
    }

    @Test
    @DisplayName("Total is the sum of the per-receivable provisions")
    void testSpecificProvision_Total() {
        ProvisionResult result = service.calculateSpecificProvision(List.of(
            new ReceivableItem("KH001", new BigDecimal("10000000"), 120),
            new ReceivableItem("KH002", new BigDecimal("10000000"), 200),
            new ReceivableItem("KH003", new BigDecimal("10000000"), 400)));

        assertEquals(0, new BigDecimal("18000000").compareTo(result.getTotalProvision().getAmount()));
        assertEquals(3, result.getItems().size());
        assertEquals(ProvisionBand.DAYS_91_TO_180, result.getItems().get(0).getBand());
        assertEquals(ProvisionBand.OVER_365_DAYS, result.getItems().get(2).getBand());
    }

    @Test
    @DisplayName("Negative overdue days fall in no band and provision nothing")
    void testSpecificProvision_NegativeDays() {
        ProvisionResult result = service.calculateSpecificProvision(
            List.of(new ReceivableItem("KH001", new BigDecimal("10000000"), -5)));

        assertNull(result.getItems().get(0).getBand());
        assertTrue(result.getTotalProvision().isZero());
    }

    @Test
    @SuppressWarnings("deprecation")
    @DisplayName("Legacy overload ignores its overdue-days argument")
    void testSpecificProvision_LegacyOverload() {
        List<ReceivableItem> items = List.of(new ReceivableItem("KH001", new BigDecimal("10000000"), 120));

        ProvisionResult legacy = service.calculateSpecificProvision(items, 999);

        assertEquals(0, new BigDecimal("3000000").compareTo(legacy.getTotalProvision().getAmount()));
    }

    @Test
    @DisplayName("General provision is 1% of total receivables")
    void testGeneralProvision() {
        Money provision = service.calculateGeneralProvision(Money.vnd("100000000"));

        assertEquals(0, new BigDecimal("1000000").compareTo(provision.getAmount()));
    }
}
