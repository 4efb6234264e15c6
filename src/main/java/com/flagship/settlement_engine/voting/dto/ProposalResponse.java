package com.flagship.settlement_engine.voting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.voting.Proposal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProposalResponse {

    @JsonProperty("index")
    int index;

    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @JsonProperty("vote_weight")
    long voteWeight;

    @JsonProperty("proposer")
    String proposer;

    public static ProposalResponse from(Proposal proposal) {
        return ProposalResponse.builder()
            .index(proposal.getIndex())
            .name(proposal.getName())
            .description(proposal.getDescription())
            .voteWeight(proposal.getVoteWeight())
            .proposer(proposal.getProposer())
            .build();
    }
}
