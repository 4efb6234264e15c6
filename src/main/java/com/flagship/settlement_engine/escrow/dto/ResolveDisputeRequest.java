package com.flagship.settlement_engine.escrow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class ResolveDisputeRequest {

    @JsonProperty("recipient")
    String recipient;
}
