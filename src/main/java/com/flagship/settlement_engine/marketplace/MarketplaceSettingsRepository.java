package com.flagship.settlement_engine.marketplace;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MarketplaceSettingsRepository extends JpaRepository<MarketplaceSettingsEntity, Integer> {
}
