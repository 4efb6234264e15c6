package com.flagship.settlement_engine.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of a pull withdrawal from any engine.
 */
@Value
public class WithdrawalResponse {

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("amount")
    BigDecimal amount;
}
