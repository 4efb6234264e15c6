package com.flagship.settlement_engine.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.marketplace.Listing;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class ListingResponse {

    @JsonProperty("token_id")
    long tokenId;

    @JsonProperty("seller")
    String seller;

    @JsonProperty("price")
    BigDecimal price;

    @JsonProperty("active")
    boolean active;

    public static ListingResponse from(Listing listing) {
        return new ListingResponse(listing.getTokenId(), listing.getSeller(), listing.getPrice(), listing.isActive());
    }
}
