package com.flagship.settlement_engine.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class CustodyResponse {

    @JsonProperty("custody")
    BigDecimal custody;

    @JsonProperty("total_pending")
    BigDecimal totalPending;
}
