package com.flagship.settlement_engine.outbox;

import com.flagship.settlement_engine.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Outbox publisher against a mocked Kafka template.
 *
 * These tests verify that:
 * - events are routed to the topic of their aggregate
 * - events are keyed by aggregate id and marked published after the send
 * - the first failed send stops the batch so later events keep their order
 */
@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    @Mock
    private OutboxService outboxService;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private OutboxMetrics outboxMetrics;

    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "escrowTopic", "settlement.escrow");
        ReflectionTestUtils.setField(publisher, "votingTopic", "settlement.voting");
        ReflectionTestUtils.setField(publisher, "marketplaceTopic", "settlement.marketplace");
        ReflectionTestUtils.setField(publisher, "ledgerTopic", "settlement.ledger");
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 5);
    }

    private static OutboxEvent event(String aggregateType, String aggregateId, String eventType) {
        return OutboxEvent.create(aggregateType, aggregateId, eventType, "{}");
    }

    private static CompletableFuture<SendResult<String, String>> sent(String topic, String key) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(topic, 0), 0L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(new ProducerRecord<>(topic, key, "{}"), metadata));
    }

    @Test
    @DisplayName("Each aggregate type is routed to its engine's topic")
    void routesByAggregateType() {
        assertEquals("settlement.escrow", publisher.getTopicForEvent(event(EventAggregates.ESCROW, "0", "EscrowCreated")));
        assertEquals("settlement.voting", publisher.getTopicForEvent(event(EventAggregates.BALLOT, "0", "Voted")));
        assertEquals("settlement.marketplace", publisher.getTopicForEvent(event(EventAggregates.ASSET, "1", "Transfer")));
        assertEquals("settlement.marketplace", publisher.getTopicForEvent(event(EventAggregates.LISTING, "1", "ItemSold")));
        assertEquals("settlement.marketplace",
            publisher.getTopicForEvent(event(EventAggregates.MARKETPLACE, "settings", "PlatformFeeUpdated")));
        assertEquals("settlement.ledger", publisher.getTopicForEvent(event(EventAggregates.ACCOUNT, "alice", "Deposited")));
    }

    @Test
    @DisplayName("Published events are keyed by aggregate id and marked published")
    void publishesAndMarks() {
        OutboxEvent created = event(EventAggregates.ESCROW, "7", "EscrowCreated");
        OutboxEvent released = event(EventAggregates.ESCROW, "7", "EscrowReleased");
        when(outboxService.findUnpublishedEvents(100, 5)).thenReturn(List.of(created, released));
        when(kafkaTemplate.send("settlement.escrow", "7", "{}")).thenReturn(sent("settlement.escrow", "7"));

        publisher.triggerPublish();

        verify(kafkaTemplate, times(2)).send("settlement.escrow", "7", "{}");
        verify(outboxService).markPublished(created.getId());
        verify(outboxService).markPublished(released.getId());
        verify(outboxMetrics).recordEventPublished("EscrowCreated");
        verify(outboxService, never()).markFailed(any(), anyString());
    }

    @Test
    @DisplayName("A failed send stops the batch and bumps the retry count")
    void stopsOnFirstFailure() {
        OutboxEvent first = event(EventAggregates.BALLOT, "3", "BallotCreated");
        OutboxEvent second = event(EventAggregates.BALLOT, "3", "VoterRegistered");
        when(outboxService.findUnpublishedEvents(100, 5)).thenReturn(List.of(first, second));
        when(kafkaTemplate.send("settlement.voting", "3", "{}"))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));

        publisher.triggerPublish();

        verify(kafkaTemplate, times(1)).send("settlement.voting", "3", "{}");
        verify(outboxService).markFailed(eq(first.getId()), anyString());
        verify(outboxService, never()).markPublished(any());
        verify(outboxService, never()).markFailed(eq(second.getId()), anyString());
        verify(outboxMetrics).recordEventPublishFailed("BallotCreated");
    }

    @Test
    @DisplayName("An empty outbox sends nothing")
    void emptyOutbox() {
        when(outboxService.findUnpublishedEvents(100, 5)).thenReturn(List.of());

        publisher.triggerPublish();

        verifyNoInteractions(kafkaTemplate);
    }
}
