package com.flagship.interunit_recon.health;

import com.flagship.interunit_recon.transaction.MatchStatus;
import com.flagship.interunit_recon.transaction.TransactionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
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
 * Liveness endpoint with a database check and the current unmatched backlog.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final TransactionRepository repository;

    public HealthController(DataSource dataSource, TransactionRepository repository) {
        this.dataSource = dataSource;
        this.repository = repository;
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

        try {
            response.put("unmatched_legs", repository.countByStatus(MatchStatus.UNMATCHED));
        } catch (DataAccessException e) {
            log.warn("Could not count unmatched legs: {}", e.getMessage());
            response.put("unmatched_legs", "UNKNOWN");
        }
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
