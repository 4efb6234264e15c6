package com.flagship.settlement_engine.outbox;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for outbox events.
 */
@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, Long> {

    Optional<OutboxEventEntity> findByEventId(UUID eventId);

    /**
     * Unpublished events in feed order, oldest first.
     */
    @Query("""
        SELECT e FROM OutboxEventEntity e
        WHERE e.publishedAt IS NULL AND e.retryCount < :maxRetries
        ORDER BY e.sequenceNumber ASC
        """)
    List<OutboxEventEntity> findPublishable(@Param("maxRetries") int maxRetries, Pageable page);

    List<OutboxEventEntity> findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
        String aggregateType, String aggregateId);

    List<OutboxEventEntity> findByAggregateTypeOrderBySequenceNumberAsc(String aggregateType);

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    long countUnpublished();

    @Query("""
        SELECT e FROM OutboxEventEntity e
        WHERE e.publishedAt IS NULL AND e.retryCount >= :maxRetries
        ORDER BY e.sequenceNumber ASC
        """)
    List<OutboxEventEntity> findDeadLetterEvents(@Param("maxRetries") int maxRetries);

    long countByRetryCountGreaterThanEqual(int retryCount);

    @Query("""
        SELECT MIN(e.createdAt) FROM OutboxEventEntity e
        WHERE e.publishedAt IS NULL
        """)
    Optional<Instant> findOldestUnpublishedCreatedAt();
}
