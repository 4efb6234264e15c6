package com.flagship.settlement_engine.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class PlatformFeeRequest {

    @NotNull(message = "Fee is required")
    @JsonProperty("fee_bps")
    Integer feeBps;
}
