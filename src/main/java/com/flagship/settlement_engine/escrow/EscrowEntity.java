package com.flagship.settlement_engine.escrow;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for escrow agreements.
 *
 * No setters: parties, amount and deadline are fixed at creation, and the state only
 * changes through {@link #updateFromDomain(Escrow)} after the domain object validated
 * the transition.
 */
@Entity
@Table(name = "escrows")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EscrowEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private Long id;

    @Column(name = "buyer_id", nullable = false, updatable = false)
    private String buyerId;

    @Column(name = "seller_id", nullable = false, updatable = false)
    private String sellerId;

    @Column(name = "arbiter_id", nullable = false, updatable = false)
    private String arbiterId;

    @Column(nullable = false, updatable = false, precision = 38, scale = 0)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private EscrowState state;

    @Column(length = 1024, updatable = false)
    private String description;

    /**
     * Persistence concern only; the domain object does not know about it.
     */
    @Column(name = "idempotency_key", updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false, updatable = false)
    private Instant deadline;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static EscrowEntity fromDomain(Escrow escrow, String idempotencyKey) {
        return new EscrowEntity(
            escrow.getId(),
            escrow.getBuyer(),
            escrow.getSeller(),
            escrow.getArbiter(),
            escrow.getAmount(),
            escrow.getState(),
            escrow.getDescription(),
            idempotencyKey,
            escrow.getCreatedAt(),
            escrow.getDeadline(),
            escrow.getUpdatedAt()
        );
    }

    public Escrow toDomain() {
        return new Escrow(
            id,
            buyerId,
            sellerId,
            arbiterId,
            amount,
            state,
            description,
            createdAt,
            deadline,
            updatedAt
        );
    }

    void updateFromDomain(Escrow escrow) {
        this.state = escrow.getState();
        this.updatedAt = escrow.getUpdatedAt();
    }
}
