package com.flagship.settlement_engine.outbox;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Notification emitted by a mutating engine call.
 *
 * Implementations carry only the notification's own fields; routing data is exposed through
 * these accessors and kept out of the serialized payload.
 */
public interface EngineEvent {

    /**
     * Aggregate the notification is about, e.g. "Escrow". Selects the Kafka topic.
     */
    @JsonIgnore
    String getAggregateType();

    /**
     * Identifier of the aggregate instance. Used as the Kafka key.
     */
    @JsonIgnore
    String getAggregateId();

    @JsonIgnore
    default String getEventType() {
        return getClass().getSimpleName();
    }
}
