package com.flagship.settlement_engine.health;

import com.flagship.settlement_engine.host.EngineHost;
import com.flagship.settlement_engine.ledger.LedgerAccounts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness probe. Unlike the Actuator health endpoint, this does not require authorization.
 *
 * Reports DOWN when the database is unreachable or when pending credits exceed the value
 * held in custody.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final LedgerAccounts ledger;
    private final EngineHost host;
    private final Clock clock;

    public HealthController(DataSource dataSource, LedgerAccounts ledger, EngineHost host, Clock clock) {
        this.dataSource = dataSource;
        this.ledger = ledger;
        this.host = host;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", clock.instant().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        boolean custodyHealthy = dbHealthy && checkCustody(response);
        response.put("custody", custodyHealthy ? "UP" : "DOWN");
        response.put("queuedCalls", host.getQueueLength());

        if (!dbHealthy || !custodyHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
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

    private boolean checkCustody(Map<String, Object> response) {
        BigDecimal custody = ledger.getCustodyBalance();
        BigDecimal pending = ledger.getTotalPending();
        response.put("custodyBalance", custody);
        response.put("totalPending", pending);
        return pending.compareTo(custody) <= 0;
    }
}
