package com.flagship.settlement_engine.voting;

import lombok.Value;

@Value
public class VotingSummary {
    String title;
    int proposalCount;
    int registeredVoters;
    int votesCast;
    boolean active;
    boolean finalized;
}
