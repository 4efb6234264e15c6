package com.flagship.settlement_engine.marketplace;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Single-row table. Absent until the fee is first changed; until then the configured
 * default applies.
 */
@Entity
@Table(name = "marketplace_settings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MarketplaceSettingsEntity {

    static final int SETTINGS_ID = 1;

    @Id
    @Column(nullable = false, updatable = false)
    private Integer id;

    @Column(name = "platform_fee_bps", nullable = false)
    private int platformFeeBps;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static MarketplaceSettingsEntity create(int platformFeeBps, Instant now) {
        MarketplaceSettingsEntity entity = new MarketplaceSettingsEntity();
        entity.id = SETTINGS_ID;
        entity.platformFeeBps = platformFeeBps;
        entity.updatedAt = now;
        return entity;
    }

    void updateFee(int platformFeeBps, Instant now) {
        this.platformFeeBps = platformFeeBps;
        this.updatedAt = now;
    }
}
