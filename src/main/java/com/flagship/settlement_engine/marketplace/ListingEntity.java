package com.flagship.settlement_engine.marketplace;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One row per token. A sold, cancelled or transferred listing stays as an inactive row and
 * is overwritten when the token is listed again.
 */
@Entity
@Table(name = "listings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ListingEntity {

    @Id
    @Column(name = "token_id", nullable = false, updatable = false)
    private Long tokenId;

    @Column(name = "seller_id", nullable = false)
    private String sellerId;

    @Column(nullable = false, precision = 38, scale = 0)
    private BigDecimal price;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "listed_at", nullable = false)
    private Instant listedAt;

    static ListingEntity create(long tokenId, String seller, BigDecimal price, Instant now) {
        return new ListingEntity(tokenId, seller, price, true, now);
    }

    void relist(String seller, BigDecimal price, Instant now) {
        this.sellerId = seller;
        this.price = price;
        this.active = true;
        this.listedAt = now;
    }

    void deactivate() {
        this.active = false;
    }

    public Listing toDomain() {
        return new Listing(tokenId, sellerId, price, active, listedAt);
    }
}
