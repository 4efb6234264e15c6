package com.flagship.settlement_engine.ledger;

import com.flagship.settlement_engine.outbox.EngineEvent;
import com.flagship.settlement_engine.outbox.EventAggregates;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Notifications about host funding.
 */
public final class LedgerEvents {

    private LedgerEvents() {
    }

    @Value
    public static class Deposited implements EngineEvent {
        String account;
        BigDecimal amount;

        @Override
        public String getAggregateType() {
            return EventAggregates.ACCOUNT;
        }

        @Override
        public String getAggregateId() {
            return account;
        }
    }
}
