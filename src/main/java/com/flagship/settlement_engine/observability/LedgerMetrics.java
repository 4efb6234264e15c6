package com.flagship.settlement_engine.observability;

import com.flagship.settlement_engine.ledger.LedgerAccounts;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Gauges for the value the engine holds and the value owed to accounts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerMetrics {

    private final LedgerAccounts ledger;
    private final MeterRegistry meterRegistry;

    private final AtomicReference<BigDecimal> custody = new AtomicReference<>(BigDecimal.ZERO);
    private final AtomicReference<BigDecimal> totalPending = new AtomicReference<>(BigDecimal.ZERO);

    @PostConstruct
    public void init() {
        Gauge.builder("ledger.custody.balance", custody, ref -> ref.get().doubleValue())
                .description("Value currently held by the engine")
                .register(meterRegistry);

        Gauge.builder("ledger.pending.total", totalPending, ref -> ref.get().doubleValue())
                .description("Sum of all pending withdrawal balances")
                .register(meterRegistry);
    }

    public void refreshMetrics() {
        try {
            custody.set(ledger.getCustodyBalance());
            totalPending.set(ledger.getTotalPending());
        } catch (Exception e) {
            log.warn("Failed to refresh ledger metrics: {}", e.getMessage());
        }
    }
}
