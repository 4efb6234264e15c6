package com.flagship.settlement_engine.marketplace;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of a purchase: who paid whom, and what went back to the buyer.
 */
@Value
public class Sale {
    long tokenId;
    String seller;
    String buyer;
    String creator;
    FeeSplit split;
    BigDecimal refunded;
}
