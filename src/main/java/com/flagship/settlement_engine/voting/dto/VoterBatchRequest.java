package com.flagship.settlement_engine.voting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class VoterBatchRequest {

    @JsonProperty("voters")
    List<String> voters;
}
