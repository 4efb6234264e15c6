package com.flagship.settlement_engine.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.marketplace.Sale;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class SaleResponse {

    @JsonProperty("token_id")
    long tokenId;

    @JsonProperty("seller")
    String seller;

    @JsonProperty("buyer")
    String buyer;

    @JsonProperty("price")
    BigDecimal price;

    @JsonProperty("platform_fee")
    BigDecimal platformFee;

    @JsonProperty("royalty")
    BigDecimal royalty;

    @JsonProperty("seller_proceeds")
    BigDecimal sellerProceeds;

    @JsonProperty("refunded")
    BigDecimal refunded;

    public static SaleResponse from(Sale sale) {
        return SaleResponse.builder()
            .tokenId(sale.getTokenId())
            .seller(sale.getSeller())
            .buyer(sale.getBuyer())
            .price(sale.getSplit().getPrice())
            .platformFee(sale.getSplit().getPlatformFee())
            .royalty(sale.getSplit().getRoyalty())
            .sellerProceeds(sale.getSplit().getSellerProceeds())
            .refunded(sale.getRefunded())
            .build();
    }
}
