package com.flagship.settlement_engine.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.marketplace.Asset;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AssetResponse {

    @JsonProperty("token_id")
    long tokenId;

    @JsonProperty("owner")
    String owner;

    @JsonProperty("creator")
    String creator;

    @JsonProperty("token_uri")
    String tokenUri;

    @JsonProperty("approved")
    String approved;

    @JsonProperty("minted_at")
    Instant mintedAt;

    public static AssetResponse from(Asset asset) {
        return AssetResponse.builder()
            .tokenId(asset.getTokenId())
            .owner(asset.getOwner())
            .creator(asset.getCreator())
            .tokenUri(asset.getTokenUri())
            .approved(asset.getApproved())
            .mintedAt(asset.getMintedAt())
            .build();
    }
}
