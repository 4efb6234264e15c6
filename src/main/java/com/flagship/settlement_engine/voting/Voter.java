package com.flagship.settlement_engine.voting;

import lombok.Value;

/**
 * A registered voter. {@code votedProposal} is only meaningful once {@code voted} is set,
 * and stays empty for voters who delegated.
 */
@Value
public class Voter {
    long ballotId;
    String account;
    long weight;
    boolean voted;
    String delegate;
    Integer votedProposal;
}
