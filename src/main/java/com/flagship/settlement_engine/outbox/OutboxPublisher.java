package com.flagship.settlement_engine.outbox;

import com.flagship.settlement_engine.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Background publisher that drains the outbox into Kafka.
 *
 * Events are sent one at a time in sequence order and keyed by aggregate id, so the
 * notifications of one escrow, ballot or token stay ordered within their partition.
 * Failed sends bump the retry count; events at the retry limit are left for manual
 * intervention.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.escrow:settlement.escrow}")
    private String escrowTopic;

    @Value("${kafka.topic.voting:settlement.voting}")
    private String votingTopic;

    @Value("${kafka.topic.marketplace:settlement.marketplace}")
    private String marketplaceTopic;

    @Value("${kafka.topic.ledger:settlement.ledger}")
    private String ledgerTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize, maxRetries);

            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());

            for (OutboxEvent event : events) {
                if (!publishEvent(event)) {
                    // keep feed order: later events wait for this one
                    break;
                }
            }

        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private boolean publishEvent(OutboxEvent event) {
        String topic = getTopicForEvent(event);

        try {
            CompletableFuture<SendResult<String, String>> future =
                    kafkaTemplate.send(topic, event.getAggregateId(), event.getPayload());
            SendResult<String, String> result = future.get();

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while publishing event {}", event.getId());
            return false;
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());

            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached max retries ({}), moving to dead letter. eventType={}, aggregateId={}",
                        event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
            return false;
        }
    }

    String getTopicForEvent(OutboxEvent event) {
        return switch (event.getAggregateType()) {
            case EventAggregates.ESCROW -> escrowTopic;
            case EventAggregates.BALLOT -> votingTopic;
            case EventAggregates.ASSET, EventAggregates.LISTING, EventAggregates.MARKETPLACE -> marketplaceTopic;
            default -> ledgerTopic;
        };
    }

    /**
     * Manually triggers publishing (useful for testing).
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
