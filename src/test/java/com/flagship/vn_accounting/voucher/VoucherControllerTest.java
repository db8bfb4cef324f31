package com.flagship.vn_accounting.voucher;

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
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Voucher API over HTTP: status codes, idempotent replay and error bodies.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class VoucherControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("vn_accounting_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
        // Disable Kafka and outbox publisher for these tests
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

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static Map<String, Object> line(String accountCode, String debit, String credit) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("account_code", accountCode);
        if (debit != null) {
            line.put("debit_amount", new BigDecimal(debit));
        }
        if (credit != null) {
            line.put("credit_amount", new BigDecimal(credit));
        }
        return line;
    }

    private String saleRequest(String date, String revenue) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("voucher_type", "BAN");
        request.put("voucher_date", date);
        request.put("description", "Sale of goods");
        request.put("lines", List.of(
            line("131", "11000000", null),
            line("5111", null, revenue),
            line("3331", null, "1000000")));
        try {
            return objectMapper.writeValueAsString(request);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private JsonNode createVoucher(String date) throws Exception {
        String body = mockMvc.perform(post("/api/v1/vouchers")
                .header("Idempotency-Key", UUID.randomUUID().toString())
                .header("X-User-Id", "accountant")
                .contentType(MediaType.APPLICATION_JSON)
                .content(saleRequest(date, "10000000")))
            .andExpect(status().isCreated())
            .andReturn()
            .getResponse()
            .getContentAsString();
        return objectMapper.readTree(body);
    }

    @Test
    @DisplayName("Create voucher returns 201 with the new voucher")
    void testCreateVoucher_Success() throws Exception {
        printTestHeader("Create Voucher");
        String key = UUID.randomUUID().toString();
        printInput("Idempotency Key", key);

        mockMvc.perform(post("/api/v1/vouchers")
                .header("Idempotency-Key", key)
                .header("X-User-Id", "accountant")
                .contentType(MediaType.APPLICATION_JSON)
                .content(saleRequest("2024-03-04", "10000000")))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").exists())
            .andExpect(jsonPath("$.voucher_number").value("CT/20240304/001"))
            .andExpect(jsonPath("$.voucher_type").value("SALE"))
            .andExpect(jsonPath("$.voucher_type_code").value("BAN"))
            .andExpect(jsonPath("$.is_signed").value(false))
            .andExpect(jsonPath("$.is_locked").value(false))
            .andExpect(jsonPath("$.created_by").value("accountant"))
            .andExpect(jsonPath("$.journal_entry_ids.length()").value(1));

        printSuccess("Voucher created");
    }

    @Test
    @DisplayName("Same request sent twice returns the same voucher with 200")
    void testCreateVoucher_IdempotentReplay() throws Exception {
        printTestHeader("Idempotent Replay");
        String key = UUID.randomUUID().toString();
        String request = saleRequest("2024-03-05", "10000000");

        String first = mockMvc.perform(post("/api/v1/vouchers")
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(request))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();

        String second = mockMvc.perform(post("/api/v1/vouchers")
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(request))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();

        String firstId = objectMapper.readTree(first).get("id").asText();
        String secondId = objectMapper.readTree(second).get("id").asText();
        printOutput("First ID", firstId);
        printOutput("Second ID", secondId);
        assertEquals(firstId, secondId);

        mockMvc.perform(get("/api/v1/vouchers")
                .param("start_date", "2024-03-05")
                .param("end_date", "2024-03-05"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    @DisplayName("Missing idempotency key is rejected with 400")
    void testCreateVoucher_MissingIdempotencyKey() throws Exception {
        printTestHeader("Missing Idempotency Key");

        mockMvc.perform(post("/api/v1/vouchers")
                .contentType(MediaType.APPLICATION_JSON)
                .content(saleRequest("2024-03-06", "10000000")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing Required Header"));
    }

    @Test
    @DisplayName("Unbalanced voucher is rejected with 422 and the totals")
    void testCreateVoucher_Unbalanced() throws Exception {
        printTestHeader("Unbalanced Voucher");

        String body = mockMvc.perform(post("/api/v1/vouchers")
                .header("Idempotency-Key", UUID.randomUUID().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(saleRequest("2024-03-07", "9000000")))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("JOURNAL_NOT_BALANCED"))
            .andReturn().getResponse().getContentAsString();

        JsonNode details = objectMapper.readTree(body).get("details");
        printOutput("Details", details);
        assertEquals(0, new BigDecimal("11000000").compareTo(new BigDecimal(details.get("total_debit").asText())));
        assertEquals(0, new BigDecimal("10000000").compareTo(new BigDecimal(details.get("total_credit").asText())));
        assertEquals(0, new BigDecimal("1000000").compareTo(new BigDecimal(details.get("difference").asText())));
    }

    @Test
    @DisplayName("Request body validation failures return 400")
    void testCreateVoucher_InvalidBody() throws Exception {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("voucher_date", "2024-03-08");
        request.put("lines", List.of());

        mockMvc.perform(post("/api/v1/vouchers")
                .header("Idempotency-Key", UUID.randomUUID().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"))
            .andExpect(jsonPath("$.details.voucherType").exists());

        mockMvc.perform(post("/api/v1/vouchers")
                .header("Idempotency-Key", UUID.randomUUID().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(saleRequest("2024-03-08", "10000000").replace("BAN", "NOT_A_TYPE")))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Signing twice returns 409")
    void testSignVoucher_Twice() throws Exception {
        printTestHeader("Sign Twice");
        String id = createVoucher("2024-03-11").get("id").asText();

        mockMvc.perform(post("/api/v1/vouchers/{id}/sign", id)
                .header("X-User-Id", "chief-accountant")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"signer_id\":\"chief-accountant\",\"signature_data\":\"SIG-001\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.is_signed").value(true))
            .andExpect(jsonPath("$.signer_id").value("chief-accountant"));

        mockMvc.perform(post("/api/v1/vouchers/{id}/sign", id))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("ALREADY_SIGNED"));

        printSuccess("Second signature rejected");
    }

    @Test
    @DisplayName("Post, lock and post-again flow over HTTP")
    void testPostAndLock() throws Exception {
        printTestHeader("Post And Lock");
        String id = createVoucher("2024-03-12").get("id").asText();

        mockMvc.perform(get("/api/v1/vouchers/{id}/balance-check", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.is_balanced").value(true));

        mockMvc.perform(post("/api/v1/vouchers/{id}/post", id).header("X-User-Id", "chief-accountant"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].is_posted").value(true))
            .andExpect(jsonPath("$[0].posted_by").value("chief-accountant"));

        String entries = mockMvc.perform(get("/api/v1/vouchers/{id}/journal-entries", id))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        String entryId = objectMapper.readTree(entries).get(0).get("id").asText();

        mockMvc.perform(post("/api/v1/journal-entries/{id}/post", entryId))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("ALREADY_POSTED"));

        mockMvc.perform(post("/api/v1/vouchers/{id}/lock", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.is_locked").value(true))
            .andExpect(jsonPath("$.lock_status").value("MANUAL"));

        mockMvc.perform(get("/api/v1/journal-entries/{id}", entryId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.is_locked").value(true));

        mockMvc.perform(post("/api/v1/vouchers/{id}/sign", id))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("ENTITY_LOCKED"));
    }

    @Test
    @DisplayName("Unknown voucher returns 404")
    void testGetVoucher_NotFound() throws Exception {
        UUID unknown = UUID.randomUUID();
        printInput("Voucher ID", unknown);

        mockMvc.perform(get("/api/v1/vouchers/{id}", unknown))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Audit trail of a voucher is queryable")
    void testAuditTrail() throws Exception {
        String id = createVoucher("2024-03-13").get("id").asText();
        mockMvc.perform(post("/api/v1/vouchers/{id}/sign", id).header("X-User-Id", "chief-accountant"))
            .andExpect(status().isOk());

        mockMvc.perform(get("/api/v1/audit-logs")
                .param("entity_type", "Voucher")
                .param("entity_id", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_elements").value(2));
    }
}
