package com.flagship.settlement_engine.observability;

import com.flagship.settlement_engine.ledger.LedgerAccounts;
import com.flagship.settlement_engine.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Custom health indicators for the settlement engine.
 */
public class HealthIndicators {

    /**
     * Unhealthy if too many notifications are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private final OutboxEventRepository outboxRepository;
        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Down if the value owed to accounts exceeds the value held.
     */
    @Component("custodyHealth")
    public static class CustodyHealthIndicator implements HealthIndicator {

        private final LedgerAccounts ledger;

        public CustodyHealthIndicator(LedgerAccounts ledger) {
            this.ledger = ledger;
        }

        @Override
        public Health health() {
            try {
                BigDecimal custody = ledger.getCustodyBalance();
                BigDecimal pending = ledger.getTotalPending();

                Health.Builder builder = pending.compareTo(custody) <= 0 ? Health.up() : Health.down();
                return builder
                        .withDetail("custody", custody)
                        .withDetail("totalPending", pending)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }
}
