package com.flagship.settlement_engine.voting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class DelegationRequest {

    @JsonProperty("to")
    String to;
}
