package com.flagship.settlement_engine.voting;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for proposals. The accumulated weight only ever grows.
 */
@Entity
@Table(name = "proposals")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProposalEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ballot_id", nullable = false, updatable = false)
    private Long ballotId;

    @Column(name = "proposal_index", nullable = false, updatable = false)
    private int proposalIndex;

    @Column(nullable = false, updatable = false)
    private String name;

    @Column(length = 1024, updatable = false)
    private String description;

    @Column(name = "vote_weight", nullable = false)
    private long voteWeight;

    @Column(name = "proposer_id", nullable = false, updatable = false)
    private String proposerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static ProposalEntity create(long ballotId, int index, String name, String description,
                                 String proposer, Instant now) {
        ProposalEntity entity = new ProposalEntity();
        entity.ballotId = ballotId;
        entity.proposalIndex = index;
        entity.name = name;
        entity.description = description;
        entity.voteWeight = 0;
        entity.proposerId = proposer;
        entity.createdAt = now;
        return entity;
    }

    public Proposal toDomain() {
        return new Proposal(ballotId, proposalIndex, name, description, voteWeight, proposerId, createdAt);
    }

    void addWeight(long weight) {
        if (weight <= 0) {
            throw new IllegalArgumentException("Vote weight must be positive: " + weight);
        }
        this.voteWeight += weight;
    }
}
