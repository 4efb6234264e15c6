package com.flagship.settlement_engine.escrow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request DTO for creating a funded escrow. The buyer is the calling principal.
 */
@Value
public class CreateEscrowRequest {

    @JsonProperty("seller")
    String seller;

    @JsonProperty("arbiter")
    String arbiter;

    @NotNull(message = "Duration is required")
    @JsonProperty("duration_seconds")
    Long durationSeconds;

    @Size(max = 1024, message = "Description must be at most 1024 characters")
    @JsonProperty("description")
    String description;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;
}
