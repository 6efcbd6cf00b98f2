package com.flagship.escrow_engine.health;

import com.flagship.escrow_engine.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness probe that needs no authorization.
 * The database decides UP or DOWN; a large outbox backlog only degrades.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final OutboxService outboxService;
    private final Clock clock;
    private final long backlogThreshold;

    public HealthController(DataSource dataSource,
                            OutboxService outboxService,
                            Clock clock,
                            @Value("${health.outbox.backlog-threshold:1000}") long backlogThreshold) {
        this.dataSource = dataSource;
        this.outboxService = outboxService;
        this.clock = clock;
        this.backlogThreshold = backlogThreshold;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", clock.instant().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        try {
            long backlog = outboxService.countUnpublished();
            response.put("outboxBacklog", backlog);
            if (backlog > backlogThreshold) {
                response.put("status", "DEGRADED");
            }
        } catch (DataAccessException e) {
            log.warn("Outbox backlog check failed: {}", e.getMessage());
            response.put("outboxBacklog", "UNKNOWN");
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
