package com.flagship.settlement_engine.marketplace;

import com.flagship.settlement_engine.ledger.Amounts;
import lombok.Value;

import java.math.BigDecimal;

/**
 * How a sale price is divided. The three parts always add up to the price.
 */
@Value
public class FeeSplit {
    BigDecimal price;
    BigDecimal platformFee;
    BigDecimal royalty;
    BigDecimal sellerProceeds;

    /**
     * @param royaltyApplies false on a primary sale, where the creator is the seller
     */
    public static FeeSplit of(BigDecimal price, int platformFeeBps, int royaltyBps, boolean royaltyApplies) {
        BigDecimal fee = Amounts.bps(price, platformFeeBps);
        BigDecimal royalty = royaltyApplies ? Amounts.bps(price, royaltyBps) : BigDecimal.ZERO;
        return new FeeSplit(price, fee, royalty, price.subtract(fee).subtract(royalty));
    }
}
