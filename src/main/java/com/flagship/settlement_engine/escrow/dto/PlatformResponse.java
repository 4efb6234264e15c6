package com.flagship.settlement_engine.escrow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class PlatformResponse {

    @JsonProperty("owner")
    String owner;

    @JsonProperty("fee_bps")
    int feeBps;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("escrow_count")
    long escrowCount;
}
