package com.flagship.settlement_engine.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * {@code to} may be null to clear the approval.
 */
@Value
public class ApprovalRequest {

    @JsonProperty("to")
    String to;
}
