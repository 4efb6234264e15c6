package com.flagship.settlement_engine.voting;

import com.flagship.settlement_engine.outbox.EngineEvent;
import com.flagship.settlement_engine.outbox.EventAggregates;
import lombok.Value;

import java.time.Instant;

/**
 * Notifications emitted by the voting engine, keyed by ballot.
 */
public final class VotingEvents {

    private VotingEvents() {
    }

    interface BallotEvent extends EngineEvent {

        long getBallotId();

        @Override
        default String getAggregateType() {
            return EventAggregates.BALLOT;
        }

        @Override
        default String getAggregateId() {
            return String.valueOf(getBallotId());
        }
    }

    @Value
    public static class BallotCreated implements BallotEvent {
        long ballotId;
        String title;
        String chairperson;
        Instant votingStart;
        Instant votingEnd;
    }

    @Value
    public static class VoterRegistered implements BallotEvent {
        long ballotId;
        String voter;
    }

    @Value
    public static class VotersBatchRegistered implements BallotEvent {
        long ballotId;
        int count;
    }

    @Value
    public static class ProposalCreated implements BallotEvent {
        long ballotId;
        int proposalIndex;
        String name;
        String proposer;
    }

    @Value
    public static class VoteCast implements BallotEvent {
        long ballotId;
        String voter;
        int proposalIndex;
        long weight;
    }

    @Value
    public static class VoteDelegated implements BallotEvent {
        long ballotId;
        String from;
        String to;
    }

    @Value
    public static class VotingFinalized implements BallotEvent {
        long ballotId;
        int winningProposal;
        String winnerName;
        long voteWeight;
    }

    @Value
    public static class VotingPeriodExtended implements BallotEvent {
        long ballotId;
        Instant newEnd;
    }
}
