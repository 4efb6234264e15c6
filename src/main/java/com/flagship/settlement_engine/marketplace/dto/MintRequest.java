package com.flagship.settlement_engine.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class MintRequest {

    @NotBlank(message = "Token URI is required")
    @JsonProperty("token_uri")
    String tokenUri;
}
