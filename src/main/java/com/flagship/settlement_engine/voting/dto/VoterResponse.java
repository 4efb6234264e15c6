package com.flagship.settlement_engine.voting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.voting.Voter;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class VoterResponse {

    @JsonProperty("account")
    String account;

    @JsonProperty("weight")
    long weight;

    @JsonProperty("voted")
    boolean voted;

    @JsonProperty("delegate")
    String delegate;

    @JsonProperty("voted_proposal")
    Integer votedProposal;

    public static VoterResponse from(Voter voter) {
        return VoterResponse.builder()
            .account(voter.getAccount())
            .weight(voter.getWeight())
            .voted(voter.isVoted())
            .delegate(voter.getDelegate())
            .votedProposal(voter.getVotedProposal())
            .build();
    }
}
