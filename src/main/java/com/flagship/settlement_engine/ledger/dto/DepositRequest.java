package com.flagship.settlement_engine.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class DepositRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;
}
