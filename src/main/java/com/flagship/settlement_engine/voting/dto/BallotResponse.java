package com.flagship.settlement_engine.voting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.voting.Ballot;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class BallotResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("title")
    String title;

    @JsonProperty("chairperson")
    String chairperson;

    @JsonProperty("voting_start")
    Instant votingStart;

    @JsonProperty("voting_end")
    Instant votingEnd;

    @JsonProperty("finalized")
    boolean finalized;

    @JsonProperty("winning_proposal")
    Integer winningProposal;

    @JsonProperty("total_voters")
    int totalVoters;

    @JsonProperty("total_votes_cast")
    int totalVotesCast;

    public static BallotResponse from(Ballot ballot) {
        return BallotResponse.builder()
            .id(ballot.getId())
            .title(ballot.getTitle())
            .chairperson(ballot.getChairperson())
            .votingStart(ballot.getVotingStart())
            .votingEnd(ballot.getVotingEnd())
            .finalized(ballot.isFinalized())
            .winningProposal(ballot.getWinningProposal())
            .totalVoters(ballot.getTotalVoters())
            .totalVotesCast(ballot.getTotalVotesCast())
            .build();
    }
}
