package com.flagship.settlement_engine.voting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class VoteRequest {

    @NotNull(message = "Proposal index is required")
    @JsonProperty("proposal")
    Integer proposal;
}
