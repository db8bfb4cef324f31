package com.flagship.vn_accounting;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;

import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Chart of accounts, period, calculation and health endpoints.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class AccountingApiTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("vn_accounting_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("kafka.topic.create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private JsonNode postJson(String path, String json) throws Exception {
        String body = mockMvc.perform(post(path)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body);
    }

    private static BigDecimal decimal(JsonNode node) {
        return new BigDecimal(node.asText());
    }

    @Test
    @DisplayName("Health and banner endpoints respond")
    void testHealth() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.database").value("UP"));

        mockMvc.perform(get("/"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.company_code").value("DEMO"));
    }

    @Test
    @DisplayName("Seeded chart of accounts is readable and searchable")
    void testChartOfAccounts() throws Exception {
        printTestHeader("Chart Of Accounts");

        mockMvc.perform(get("/api/v1/accounts/{code}", "5111"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.account_type").value("REVENUE"))
            .andExpect(jsonPath("$.balance_direction").value("CREDIT"));

        mockMvc.perform(get("/api/v1/accounts/search").param("pattern", "156*"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(3));

        mockMvc.perform(get("/api/v1/accounts").param("type", "EXPENSE"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[*].account_type").value(everyItem(is("EXPENSE"))));

        mockMvc.perform(get("/api/v1/accounts/{code}", "9999"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Accounts can be added once; a duplicate code conflicts")
    void testCreateAccount() throws Exception {
        String request = """
            {"code": "13881", "name": "Other receivables - staff", "account_type": "ASSET",
             "parent_code": "1388", "is_detail": true}
            """;

        mockMvc.perform(post("/api/v1/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(request))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.code").value("13881"))
            .andExpect(jsonPath("$.balance_direction").value("DEBIT"))
            .andExpect(jsonPath("$.is_detail").value(true));

        mockMvc.perform(post("/api/v1/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(request))
            .andExpect(status().isConflict());

        mockMvc.perform(post("/api/v1/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"code\": \"1A\", \"name\": \"Bad\", \"account_type\": \"ASSET\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"));
    }

    @Test
    @DisplayName("Period lock over HTTP, then status reports it closed")
    void testLockPeriod() throws Exception {
        printTestHeader("Lock Period API");

        JsonNode result = postJson("/api/v1/periods/lock",
                "{\"period_type\": \"MONTH\", \"year\": 2038, \"period_value\": 6}");
        printOutput("Result", result);

        assertFalse(result.get("already_locked").asBoolean());
        assertEquals("2038-06", result.get("period").get("name").asText());
        assertEquals("MONTH_LOCKED", result.get("period").get("lock_status").asText());

        mockMvc.perform(get("/api/v1/periods/status").param("date", "2038-06-15"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.is_open").value(false));
        mockMvc.perform(get("/api/v1/periods/status").param("date", "2038-07-01"))
            .andExpect(jsonPath("$.is_open").value(true));
        mockMvc.perform(get("/api/v1/periods").param("year", "2038"))
            .andExpect(jsonPath("$.length()").value(1));

        mockMvc.perform(post("/api/v1/periods/lock")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"period_type\": \"QUARTER\", \"year\": 2038}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Cost of goods sold endpoint applies the requested method")
    void testCostOfGoodsSold() throws Exception {
        String inventory = """
            "inventory": [
              {"product_code": "SP001", "remaining_qty": 30, "unit_cost": 100000, "receipt_date": "2025-01-01"},
              {"product_code": "SP001", "remaining_qty": 40, "unit_cost": 110000, "receipt_date": "2025-02-01"}
            ]""";
        String goods = "\"goods\": [{\"product_code\": \"SP001\", \"quantity\": 50}]";

        JsonNode fifo = postJson("/api/v1/inventory/cost-of-goods-sold",
                "{\"method\": \"FIFO\", " + goods + ", " + inventory + "}");
        JsonNode lifo = postJson("/api/v1/inventory/cost-of-goods-sold",
                "{\"method\": \"LIFO\", " + goods + ", " + inventory + "}");
        JsonNode average = postJson("/api/v1/inventory/cost-of-goods-sold",
                "{\"method\": \"WEIGHTED_AVG\", " + goods + ", " + inventory + "}");

        assertEquals(0, new BigDecimal("5200000").compareTo(decimal(fifo.get("total_cost"))));
        assertEquals(0, new BigDecimal("5400000").compareTo(decimal(lifo.get("total_cost"))));
        assertEquals("WEIGHTED_AVERAGE", average.get("method").asText());
        assertTrue(new BigDecimal("5285714.29").subtract(decimal(average.get("total_cost"))).abs()
                .compareTo(BigDecimal.ONE) < 0);
    }

    @Test
    @DisplayName("Inventory reconciliation books a shortage to 1381")
    void testReconcileInventory() throws Exception {
        JsonNode result = postJson("/api/v1/inventory/reconcile", """
            {"product_code": "SP001", "actual_quantity": 90, "book_quantity": 100, "unit_cost": 50000}
            """);

        assertEquals("1381", result.get("account_code").asText());
        assertEquals(0, new BigDecimal("500000").compareTo(decimal(result.get("amount"))));
    }

    @Test
    @DisplayName("Provision endpoints apply the overdue bands and the general rate")
    void testProvisions() throws Exception {
        JsonNode specific = postJson("/api/v1/provisions/specific", """
            {"receivables": [
              {"customer_code": "KH001", "amount": 10000000, "overdue_days": 120},
              {"customer_code": "KH002", "amount": 10000000, "overdue_days": 30}
            ]}
            """);
        assertEquals(0, new BigDecimal("3000000").compareTo(decimal(specific.get("total_provision"))));

        String general = mockMvc.perform(get("/api/v1/provisions/general").param("total_receivables", "100000000"))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        assertEquals(0, new BigDecimal("1000000").compareTo(decimal(objectMapper.readTree(general).get("provision"))));
    }

    @Test
    @DisplayName("Exchange endpoints convert and classify differences")
    void testExchangeRates() throws Exception {
        JsonNode converted = postJson("/api/v1/exchange-rates/convert",
                "{\"amount\": 100, \"currency\": \"USD\", \"rate\": 25000}");
        assertEquals(0, new BigDecimal("2500000").compareTo(decimal(converted.get("vnd_amount"))));

        JsonNode difference = postJson("/api/v1/exchange-rates/difference",
                "{\"amount\": 1000, \"currency\": \"USD\", \"original_rate\": 24000, \"current_rate\": 24500}");
        assertEquals("4131", difference.get("account_code").asText());
        assertEquals(0, new BigDecimal("500000").compareTo(decimal(difference.get("difference"))));
    }

    @Test
    @DisplayName("Journal entry search needs an account code or a full date range")
    void testJournalEntrySearch_RequiresFilter() throws Exception {
        mockMvc.perform(get("/api/v1/journal-entries"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/v1/journal-entries")
                .param("start_date", "2024-01-01")
                .param("end_date", "2024-01-31"))
            .andExpect(status().isOk());
    }
}
