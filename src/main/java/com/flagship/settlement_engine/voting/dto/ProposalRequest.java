package com.flagship.settlement_engine.voting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class ProposalRequest {

    @NotBlank(message = "Proposal name is required")
    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;
}
