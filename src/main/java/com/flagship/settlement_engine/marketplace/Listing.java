package com.flagship.settlement_engine.marketplace;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
public class Listing {
    long tokenId;
    String seller;
    BigDecimal price;
    boolean active;
    Instant listedAt;

    /**
     * Placeholder for a token that has never been listed.
     */
    public static Listing unlisted(long tokenId) {
        return new Listing(tokenId, null, BigDecimal.ZERO, false, null);
    }
}
