package com.flagship.settlement_engine.voting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.voting.VotingSummary;
import lombok.Value;

@Value
public class VotingSummaryResponse {

    @JsonProperty("title")
    String title;

    @JsonProperty("proposal_count")
    int proposalCount;

    @JsonProperty("registered_voters")
    int registeredVoters;

    @JsonProperty("votes_cast")
    int votesCast;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("finalized")
    boolean finalized;

    public static VotingSummaryResponse from(VotingSummary summary) {
        return new VotingSummaryResponse(summary.getTitle(), summary.getProposalCount(),
            summary.getRegisteredVoters(), summary.getVotesCast(), summary.isActive(), summary.isFinalized());
    }
}
