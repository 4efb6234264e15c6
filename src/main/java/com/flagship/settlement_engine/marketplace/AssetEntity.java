package com.flagship.settlement_engine.marketplace;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "assets")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AssetEntity {

    @Id
    @Column(name = "token_id", nullable = false, updatable = false)
    private Long tokenId;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Column(name = "creator_id", nullable = false, updatable = false)
    private String creatorId;

    @Column(name = "token_uri", nullable = false, updatable = false, length = 1024)
    private String tokenUri;

    @Column(name = "approved_id")
    private String approvedId;

    @Column(name = "minted_at", nullable = false, updatable = false)
    private Instant mintedAt;

    static AssetEntity mint(long tokenId, String creator, String tokenUri, Instant now) {
        return new AssetEntity(tokenId, creator, creator, tokenUri, null, now);
    }

    /**
     * Moves ownership; any single-token approval is cleared.
     */
    void transferTo(String newOwner) {
        this.ownerId = newOwner;
        this.approvedId = null;
    }

    void approve(String account) {
        this.approvedId = account;
    }

    public Asset toDomain() {
        return new Asset(tokenId, ownerId, creatorId, tokenUri, approvedId, mintedAt);
    }
}
