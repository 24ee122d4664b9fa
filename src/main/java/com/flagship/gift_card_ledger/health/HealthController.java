package com.flagship.gift_card_ledger.health;

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
 * Service info and a plain liveness/readiness check.
 * Unlike the Actuator health endpoint, neither requires authorization.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final String name;
    private final String version;

    public HealthController(DataSource dataSource,
                            @Value("${app.name:Gift Card Platform API}") String name,
                            @Value("${app.version:1.0.0}") String version) {
        this.dataSource = dataSource;
        this.name = name;
        this.version = version;
    }

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> info() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("name", name);
        response.put("version", version);
        response.put("status", "active");
        return ResponseEntity.ok(response);
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
