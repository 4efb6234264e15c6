package com.flagship.settlement_engine.escrow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.escrow.Escrow;
import com.flagship.settlement_engine.escrow.EscrowState;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class EscrowResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("buyer")
    String buyer;

    @JsonProperty("seller")
    String seller;

    @JsonProperty("arbiter")
    String arbiter;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("state")
    EscrowState state;

    @JsonProperty("description")
    String description;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("deadline")
    Instant deadline;

    public static EscrowResponse from(Escrow escrow) {
        return EscrowResponse.builder()
            .id(escrow.getId())
            .buyer(escrow.getBuyer())
            .seller(escrow.getSeller())
            .arbiter(escrow.getArbiter())
            .amount(escrow.getAmount())
            .state(escrow.getState())
            .description(escrow.getDescription())
            .createdAt(escrow.getCreatedAt())
            .deadline(escrow.getDeadline())
            .build();
    }
}
