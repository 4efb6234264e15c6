package com.flagship.settlement_engine.voting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.Instant;

@Value
public class ExtensionRequest {

    @NotNull(message = "New end is required")
    @JsonProperty("new_end")
    Instant newEnd;
}
