package com.flagship.settlement_engine.voting;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for ballots. Counters and the window only change through the package-private
 * methods below, called by {@link VotingService} after its checks passed.
 */
@Entity
@Table(name = "ballots")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BallotEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private Long id;

    @Column(nullable = false, updatable = false)
    private String title;

    @Column(name = "chairperson_id", nullable = false, updatable = false)
    private String chairpersonId;

    @Column(name = "voting_start", nullable = false, updatable = false)
    private Instant votingStart;

    @Column(name = "voting_end", nullable = false)
    private Instant votingEnd;

    @Column(nullable = false)
    private boolean finalized;

    @Column(name = "winning_proposal")
    private Integer winningProposal;

    @Column(name = "total_voters", nullable = false)
    private int totalVoters;

    @Column(name = "total_votes_cast", nullable = false)
    private int totalVotesCast;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static BallotEntity create(long id, String title, String chairperson,
                               Instant votingStart, Instant votingEnd, Instant now) {
        BallotEntity entity = new BallotEntity();
        entity.id = id;
        entity.title = title;
        entity.chairpersonId = chairperson;
        entity.votingStart = votingStart;
        entity.votingEnd = votingEnd;
        entity.finalized = false;
        entity.totalVoters = 0;
        entity.totalVotesCast = 0;
        entity.createdAt = now;
        return entity;
    }

    public Ballot toDomain() {
        return new Ballot(
            id,
            title,
            chairpersonId,
            votingStart,
            votingEnd,
            finalized,
            winningProposal,
            totalVoters,
            totalVotesCast,
            createdAt
        );
    }

    void voterRegistered() {
        this.totalVoters++;
    }

    void voteCast() {
        this.totalVotesCast++;
    }

    void extendTo(Instant newEnd) {
        this.votingEnd = newEnd;
    }

    void finalizeWith(int winningProposal) {
        if (this.finalized) {
            throw new IllegalStateException("Ballot " + id + " is already finalized");
        }
        this.finalized = true;
        this.winningProposal = winningProposal;
    }
}
