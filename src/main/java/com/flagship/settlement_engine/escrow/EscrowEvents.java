package com.flagship.settlement_engine.escrow;

import com.flagship.settlement_engine.outbox.EngineEvent;
import com.flagship.settlement_engine.outbox.EventAggregates;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Notifications emitted by the escrow engine.
 */
public final class EscrowEvents {

    private EscrowEvents() {
    }

    /**
     * Base for notifications about one agreement.
     */
    interface EscrowEvent extends EngineEvent {

        long getEscrowId();

        @Override
        default String getAggregateType() {
            return EventAggregates.ESCROW;
        }

        @Override
        default String getAggregateId() {
            return String.valueOf(getEscrowId());
        }
    }

    @Value
    public static class EscrowCreated implements EscrowEvent {
        long escrowId;
        String buyer;
        String seller;
        String arbiter;
        BigDecimal amount;
        Instant deadline;
        String description;
    }

    @Value
    public static class EscrowFunded implements EscrowEvent {
        long escrowId;
        String buyer;
        BigDecimal amount;
    }

    @Value
    public static class EscrowReleased implements EscrowEvent {
        long escrowId;
        BigDecimal sellerAmount;
        BigDecimal fee;
    }

    @Value
    public static class EscrowRefunded implements EscrowEvent {
        long escrowId;
        BigDecimal amount;
    }

    @Value
    public static class DisputeRaised implements EscrowEvent {
        long escrowId;
        String raisedBy;
    }

    @Value
    public static class DisputeResolved implements EscrowEvent {
        long escrowId;
        String recipient;
        BigDecimal amount;
    }

    @Value
    public static class PlatformFeesWithdrawn implements EngineEvent {
        String owner;
        BigDecimal amount;

        @Override
        public String getAggregateType() {
            return EventAggregates.ESCROW;
        }

        @Override
        public String getAggregateId() {
            return owner;
        }
    }

    @Value
    public static class FundsWithdrawn implements EngineEvent {
        String account;
        BigDecimal amount;

        @Override
        public String getAggregateType() {
            return EventAggregates.ESCROW;
        }

        @Override
        public String getAggregateId() {
            return account;
        }
    }
}
