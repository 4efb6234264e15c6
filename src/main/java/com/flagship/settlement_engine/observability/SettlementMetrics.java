package com.flagship.settlement_engine.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Centralized metrics for engine calls.
 *
 * Metrics exposed:
 * - engine.calls: counter tagged by engine, operation and outcome (success or failure kind)
 * - engine.call.duration: timer tagged by engine and operation
 * - engine.reentrancy.rejected: counter of rejected nested calls
 * - ledger.value.moved: distribution summary of value moved per operation
 * - idempotency.cache: hits and misses for idempotent creates
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCall(String engine, String operation, String outcome, Duration duration) {
        registry.counter("engine.calls",
                "engine", sanitizeTag(engine),
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();

        registry.timer("engine.call.duration",
                "engine", sanitizeTag(engine),
                "operation", sanitizeTag(operation)
        ).record(duration);
    }

    public void recordReentrancyRejected(String engine, String operation) {
        registry.counter("engine.reentrancy.rejected",
                "engine", sanitizeTag(engine),
                "operation", sanitizeTag(operation)
        ).increment();
    }

    public void recordValueMoved(String operation, BigDecimal amount) {
        registry.summary("ledger.value.moved",
                "operation", sanitizeTag(operation)
        ).record(amount.doubleValue());
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
