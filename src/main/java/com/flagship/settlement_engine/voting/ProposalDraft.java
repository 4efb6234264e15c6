package com.flagship.settlement_engine.voting;

import lombok.Value;

/**
 * Name and description of a proposal to be added to a ballot.
 */
@Value
public class ProposalDraft {
    String name;
    String description;
}
