package com.flagship.settlement_engine.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class PurchaseRequest {

    @NotNull(message = "Payment is required")
    @JsonProperty("payment")
    BigDecimal payment;
}
