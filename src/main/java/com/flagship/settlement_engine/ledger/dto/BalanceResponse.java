package com.flagship.settlement_engine.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.ledger.AccountBalance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("available")
    BigDecimal available;

    @JsonProperty("pending_withdrawal")
    BigDecimal pendingWithdrawal;

    public static BalanceResponse from(AccountBalance balance) {
        return BalanceResponse.builder()
            .accountId(balance.getAccountId())
            .available(balance.getAvailable())
            .pendingWithdrawal(balance.getPendingWithdrawal())
            .build();
    }
}
