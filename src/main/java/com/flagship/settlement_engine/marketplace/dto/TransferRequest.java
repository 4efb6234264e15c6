package com.flagship.settlement_engine.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class TransferRequest {

    @JsonProperty("from")
    String from;

    @JsonProperty("to")
    String to;
}
