package com.flagship.vn_accounting.health;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain liveness/readiness probe and service banner.
 * Unlike the Actuator health endpoint, this does not require authorization.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final String applicationName;
    private final String companyCode;

    public HealthController(DataSource dataSource,
                            @Value("${spring.application.name:vn-accounting-ledger}") String applicationName,
                            @Value("${accounting.company-code:DEMO}") String companyCode) {
        this.dataSource = dataSource;
        this.applicationName = applicationName;
        this.companyCode = companyCode;
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("name", applicationName);
        response.put("company_code", companyCode);
        response.put("standard", "Circular 99/2025/TT-BTC");
        response.put("docs", "/actuator");
        return response;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            return false;
        }
    }
}
