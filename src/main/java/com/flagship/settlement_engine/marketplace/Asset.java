package com.flagship.settlement_engine.marketplace;

import lombok.Value;

import java.time.Instant;

/**
 * A unique, transferable item. The creator is fixed at mint time and earns royalties on
 * resales.
 */
@Value
public class Asset {
    long tokenId;
    String owner;
    String creator;
    String tokenUri;
    String approved;
    Instant mintedAt;

    public boolean isPrimarySale(String seller) {
        return creator.equals(seller);
    }
}
