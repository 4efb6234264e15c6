package com.flagship.settlement_engine.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A notification waiting in (or already sent from) the outbox.
 *
 * Written in the same transaction as the engine call that produced it, so it exists
 * exactly when the call committed. Published to Kafka afterwards by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // e.g., "Escrow"
    String aggregateId;        // e.g., escrow id
    String eventType;          // e.g., "EscrowReleased"
    String payload;            // JSON payload
    Instant createdAt;
    Instant publishedAt;       // null if not yet published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    /**
     * Creates a new unpublished outbox event.
     */
    public static OutboxEvent create(String aggregateType, String aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,  // not published yet
            0,     // no retries yet
            null,  // no errors yet
            null   // sequence assigned by database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
