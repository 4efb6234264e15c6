package com.flagship.settlement_engine.voting;

import lombok.Value;

import java.time.Instant;

/**
 * One voting session: a chairperson, a voting window and a set of proposals.
 */
@Value
public class Ballot {
    long id;
    String title;
    String chairperson;
    Instant votingStart;
    Instant votingEnd;
    boolean finalized;
    Integer winningProposal;
    int totalVoters;
    int totalVotesCast;
    Instant createdAt;

    /**
     * Votes are accepted from the start to the end of the window, both inclusive.
     */
    public boolean isActive(Instant now) {
        return !now.isBefore(votingStart) && !now.isAfter(votingEnd);
    }

    public boolean hasEnded(Instant now) {
        return now.isAfter(votingEnd);
    }
}
