package com.flagship.settlement_engine.voting;

import lombok.Value;

import java.time.Instant;

@Value
public class Proposal {
    long ballotId;
    int index;
    String name;
    String description;
    long voteWeight;
    String proposer;
    Instant createdAt;
}
