package com.flagship.settlement_engine.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class HolderResponse {

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("token_balance")
    long tokenBalance;

    @JsonProperty("pending_withdrawal")
    BigDecimal pendingWithdrawal;
}
