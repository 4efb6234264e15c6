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

/**
 * JPA entity for a voter registered on one ballot.
 */
@Entity
@Table(name = "voters")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class VoterEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ballot_id", nullable = false, updatable = false)
    private Long ballotId;

    @Column(name = "account_id", nullable = false, updatable = false)
    private String accountId;

    @Column(nullable = false)
    private long weight;

    @Column(name = "has_voted", nullable = false)
    private boolean hasVoted;

    @Column(name = "delegate_id")
    private String delegateId;

    @Column(name = "voted_proposal")
    private Integer votedProposal;

    static VoterEntity register(long ballotId, String accountId) {
        VoterEntity entity = new VoterEntity();
        entity.ballotId = ballotId;
        entity.accountId = accountId;
        entity.weight = 1;
        entity.hasVoted = false;
        return entity;
    }

    public Voter toDomain() {
        return new Voter(ballotId, accountId, weight, hasVoted, delegateId, votedProposal);
    }

    void votedFor(int proposalIndex) {
        this.hasVoted = true;
        this.votedProposal = proposalIndex;
    }

    void delegatedTo(String delegate) {
        this.hasVoted = true;
        this.delegateId = delegate;
    }

    void receiveWeight(long delegatedWeight) {
        this.weight += delegatedWeight;
    }
}
