package com.flagship.settlement_engine.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class OperatorApprovalRequest {

    @NotNull(message = "Approved flag is required")
    @JsonProperty("approved")
    Boolean approved;
}
