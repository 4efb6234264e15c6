package com.flagship.settlement_engine.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class MarketplaceResponse {

    @JsonProperty("owner")
    String owner;

    @JsonProperty("platform_fee_bps")
    int platformFeeBps;

    @JsonProperty("creator_royalty_bps")
    int creatorRoyaltyBps;

    @JsonProperty("total_supply")
    long totalSupply;

    @JsonProperty("active_listings")
    long activeListings;
}
