package com.flagship.settlement_engine.voting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Request DTO for opening a ballot. The chairperson is the calling principal.
 */
@Value
public class CreateBallotRequest {

    @NotBlank(message = "Title is required")
    @JsonProperty("title")
    String title;

    @NotNull(message = "Voting start is required")
    @JsonProperty("voting_start")
    Instant votingStart;

    @NotNull(message = "Voting end is required")
    @JsonProperty("voting_end")
    Instant votingEnd;

    @Valid
    @JsonProperty("proposals")
    List<ProposalRequest> proposals;
}
