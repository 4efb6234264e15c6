package com.flagship.settlement_engine.voting;

import com.flagship.settlement_engine.exception.FailureKind;
import com.flagship.settlement_engine.exception.SettlementException;
import com.flagship.settlement_engine.support.MutableClock;
import com.flagship.settlement_engine.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.flagship.settlement_engine.support.TestAccounts.unique;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Ballots with weighted votes and transitive delegation.
 */
@SpringBootTest
@Import(TestClockConfig.class)
class VotingServiceTest {

    private static final Instant START = TestClockConfig.START;
    private static final Instant END = START.plus(Duration.ofDays(7));

    @Autowired
    private VotingService votingService;

    @Autowired
    private MutableClock clock;

    private String chair;
    private long ballotId;

    @BeforeEach
    void setUp() {
        clock.setInstant(START.plus(Duration.ofHours(1)));
        chair = unique("chair");
        ballotId = votingService.createBallot(chair, "Budget", START, END, List.of(
            new ProposalDraft("Alpha", "first"),
            new ProposalDraft("Beta", "second"),
            new ProposalDraft("Gamma", "third"))).getId();
    }

    private String registered(String role) {
        String voter = unique(role);
        votingService.registerVoter(chair, ballotId, voter);
        return voter;
    }

    private long weightOf(int proposalIndex) {
        return votingService.getProposal(ballotId, proposalIndex).getVoteWeight();
    }

    private static void assertFails(FailureKind expected, Executable call) {
        SettlementException e = assertThrows(SettlementException.class, call);
        assertEquals(expected, e.getKind(), e.getMessage());
    }

    @Nested
    @DisplayName("Ballot setup")
    class Setup {

        @Test
        @DisplayName("Creating a ballot registers the chairperson and indexes proposals from 0")
        void createBallot() {
            Ballot ballot = votingService.getBallot(ballotId);
            assertEquals(chair, ballot.getChairperson());
            assertEquals(1, ballot.getTotalVoters());
            assertTrue(votingService.isRegistered(ballotId, chair));

            List<Proposal> proposals = votingService.getProposals(ballotId);
            assertEquals(List.of("Alpha", "Beta", "Gamma"), proposals.stream().map(Proposal::getName).toList());
            assertEquals(List.of(0, 1, 2), proposals.stream().map(Proposal::getIndex).toList());
            assertEquals(chair, proposals.get(0).getProposer());
        }

        @Test
        @DisplayName("End before start fails with InvalidTimeRange")
        void invalidTimeRange() {
            assertFails(FailureKind.INVALID_TIME_RANGE,
                () -> votingService.createBallot(chair, "Bad", END, START, List.of()));
        }

        @Test
        @DisplayName("Only the chairperson registers voters, once each")
        void registration() {
            String voter = registered("voter");

            assertFails(FailureKind.NOT_CHAIRPERSON, () -> votingService.registerVoter(voter, ballotId, unique("x")));
            assertFails(FailureKind.ZERO_ADDRESS, () -> votingService.registerVoter(chair, ballotId, null));
            assertFails(FailureKind.VOTER_ALREADY_REGISTERED, () -> votingService.registerVoter(chair, ballotId, voter));

            Voter record = votingService.getVoter(ballotId, voter);
            assertEquals(1, record.getWeight());
            assertFalse(record.isVoted());
        }

        @Test
        @DisplayName("Batch registration skips missing and already registered ids")
        void batchRegistration() {
            String existing = registered("existing");
            String fresh1 = unique("fresh");
            String fresh2 = unique("fresh");

            int count = votingService.registerVotersBatch(chair, ballotId,
                Arrays.asList(existing, null, fresh1, "", fresh2, fresh1));

            assertEquals(2, count);
            assertTrue(votingService.isRegistered(ballotId, fresh1));
            assertTrue(votingService.isRegistered(ballotId, fresh2));
            assertEquals(4, votingService.getBallot(ballotId).getTotalVoters());
        }

        @Test
        @DisplayName("Proposals can be added by the chairperson until the ballot ends")
        void addProposal() {
            Proposal delta = votingService.addProposal(chair, ballotId, "Delta", "fourth");
            assertEquals(3, delta.getIndex());

            assertFails(FailureKind.NOT_CHAIRPERSON,
                () -> votingService.addProposal(unique("other"), ballotId, "Epsilon", ""));

            clock.setInstant(END.plusSeconds(1));
            assertFails(FailureKind.VOTING_NOT_ACTIVE,
                () -> votingService.addProposal(chair, ballotId, "Late", ""));
        }

        @Test
        @DisplayName("Unknown ballot fails with BallotNotFound")
        void unknownBallot() {
            assertFails(FailureKind.BALLOT_NOT_FOUND, () -> votingService.getBallot(Long.MAX_VALUE));
            assertFails(FailureKind.BALLOT_NOT_FOUND, () -> votingService.vote(chair, Long.MAX_VALUE, 0));
        }
    }

    @Nested
    @DisplayName("Voting")
    class Voting {

        @Test
        @DisplayName("A vote adds the voter's weight once")
        void voteOnce() {
            String voter = registered("voter");

            Voter record = votingService.vote(voter, ballotId, 1);

            assertTrue(record.isVoted());
            assertEquals(1, record.getVotedProposal());
            assertEquals(1, weightOf(1));
            assertFails(FailureKind.ALREADY_VOTED, () -> votingService.vote(voter, ballotId, 2));
            assertEquals(0, weightOf(2));
        }

        @Test
        @DisplayName("Unregistered voters and invalid proposals are rejected")
        void invalidVotes() {
            String voter = registered("voter");
            assertFails(FailureKind.VOTER_NOT_REGISTERED, () -> votingService.vote(unique("stranger"), ballotId, 0));
            assertFails(FailureKind.INVALID_PROPOSAL, () -> votingService.vote(voter, ballotId, 3));
            assertFalse(votingService.getVoter(ballotId, voter).isVoted());
        }

        @Test
        @DisplayName("The voting window is inclusive at both ends")
        void votingWindow() {
            String early = registered("early");
            String atEnd = registered("atEnd");
            String late = registered("late");

            clock.setInstant(START.minusSeconds(1));
            assertFails(FailureKind.VOTING_NOT_ACTIVE, () -> votingService.vote(early, ballotId, 0));

            clock.setInstant(START);
            votingService.vote(early, ballotId, 0);

            clock.setInstant(END);
            votingService.vote(atEnd, ballotId, 0);

            clock.setInstant(END.plusSeconds(1));
            assertFails(FailureKind.VOTING_NOT_ACTIVE, () -> votingService.vote(late, ballotId, 0));
            assertEquals(2, weightOf(0));
        }
    }

    @Nested
    @DisplayName("Delegation")
    class Delegation {

        @Test
        @DisplayName("Weight follows the chain to its final delegate")
        void transitiveDelegation() {
            String a = registered("a");
            String b = registered("b");
            String c = registered("c");

            votingService.delegate(a, ballotId, b);
            Voter delegated = votingService.delegate(b, ballotId, c);

            assertTrue(delegated.isVoted());
            assertEquals(3, votingService.getVoter(ballotId, c).getWeight());

            votingService.vote(c, ballotId, 2);
            assertEquals(3, weightOf(2));
        }

        @Test
        @DisplayName("Delegating to someone who already voted adds to their proposal")
        void delegateToVoted() {
            String a = registered("a");
            String b = registered("b");
            votingService.vote(b, ballotId, 1);

            votingService.delegate(a, ballotId, b);

            assertEquals(2, weightOf(1));
            assertEquals(1, votingService.getVoter(ballotId, b).getWeight());
        }

        @Test
        @DisplayName("Self delegation and delegation after voting are rejected")
        void invalidDelegations() {
            String a = registered("a");
            String b = registered("b");

            assertFails(FailureKind.SELF_DELEGATION_NOT_ALLOWED, () -> votingService.delegate(a, ballotId, a));
            assertFails(FailureKind.VOTER_NOT_REGISTERED, () -> votingService.delegate(a, ballotId, unique("x")));

            votingService.vote(a, ballotId, 0);
            assertFails(FailureKind.ALREADY_VOTED, () -> votingService.delegate(a, ballotId, b));
        }

        @Test
        @DisplayName("A cycle fails with DelegationLoopDetected and changes nothing")
        void loopDetected() {
            String a = registered("a");
            String b = registered("b");
            votingService.delegate(a, ballotId, b);

            assertFails(FailureKind.DELEGATION_LOOP_DETECTED, () -> votingService.delegate(b, ballotId, a));

            Voter record = votingService.getVoter(ballotId, b);
            assertFalse(record.isVoted());
            assertNull(record.getDelegate());
            assertEquals(2, record.getWeight());
        }

        @Test
        @DisplayName("A chain of 50 hops is followed, 51 hops is rejected and rolled back")
        void hopLimit() {
            // w0 -> w1 -> ... -> w51: each link is made before its target delegates onward
            List<String> chain = new ArrayList<>();
            for (int i = 0; i <= 51; i++) {
                chain.add(unique("w" + i));
            }
            String near = unique("near");
            String far = unique("far");
            List<String> voters = new ArrayList<>(chain);
            voters.add(near);
            voters.add(far);
            votingService.registerVotersBatch(chair, ballotId, voters);

            for (int i = 0; i < 51; i++) {
                votingService.delegate(chain.get(i), ballotId, chain.get(i + 1));
            }
            String end = chain.get(51);
            assertEquals(chain.get(1), votingService.getVoter(ballotId, chain.get(0)).getDelegate());
            assertEquals(52, votingService.getVoter(ballotId, end).getWeight());

            Voter accepted = votingService.delegate(near, ballotId, chain.get(1));
            assertEquals(end, accepted.getDelegate());
            assertEquals(53, votingService.getVoter(ballotId, end).getWeight());

            assertFails(FailureKind.DELEGATION_LOOP_DETECTED,
                () -> votingService.delegate(far, ballotId, chain.get(0)));

            Voter rejected = votingService.getVoter(ballotId, far);
            assertFalse(rejected.isVoted());
            assertNull(rejected.getDelegate());
            assertEquals(1, rejected.getWeight());
            assertEquals(53, votingService.getVoter(ballotId, end).getWeight());
        }

        @Test
        @DisplayName("Delegation outside the voting window is rejected")
        void delegationWindow() {
            String a = registered("a");
            String b = registered("b");
            clock.setInstant(END.plusSeconds(1));
            assertFails(FailureKind.VOTING_NOT_ACTIVE, () -> votingService.delegate(a, ballotId, b));
        }
    }

    @Nested
    @DisplayName("Finalization")
    class Finalization {

        @Test
        @DisplayName("Finalize picks the heaviest proposal, once, after the window")
        void finalizeBallot() {
            votingService.vote(registered("v"), ballotId, 1);
            votingService.vote(registered("v"), ballotId, 1);
            votingService.vote(registered("v"), ballotId, 2);

            assertFails(FailureKind.VOTING_STILL_ACTIVE, () -> votingService.finalizeBallot(chair, ballotId));

            clock.setInstant(END.plusSeconds(1));
            assertFails(FailureKind.NOT_CHAIRPERSON, () -> votingService.finalizeBallot(unique("x"), ballotId));

            Proposal winner = votingService.finalizeBallot(chair, ballotId);
            assertEquals(1, winner.getIndex());
            assertEquals("Beta", votingService.getWinnerName(ballotId));
            assertEquals(1, votingService.getBallot(ballotId).getWinningProposal());

            assertFails(FailureKind.ALREADY_FINALIZED, () -> votingService.finalizeBallot(chair, ballotId));
            assertFails(FailureKind.ALREADY_FINALIZED,
                () -> votingService.extendVoting(chair, ballotId, END.plus(Duration.ofDays(1))));
        }

        @Test
        @DisplayName("Ties go to the lowest index")
        void tieBreak() {
            votingService.vote(registered("v"), ballotId, 2);
            votingService.vote(registered("v"), ballotId, 1);
            assertEquals(1, votingService.getWinningProposal(ballotId).getIndex());
        }

        @Test
        @DisplayName("Extending the end reopens voting")
        void extendVoting() {
            String voter = registered("voter");
            assertFails(FailureKind.INVALID_TIME_RANGE, () -> votingService.extendVoting(chair, ballotId, END));

            Instant newEnd = END.plus(Duration.ofDays(2));
            assertEquals(newEnd, votingService.extendVoting(chair, ballotId, newEnd).getVotingEnd());

            clock.setInstant(END.plus(Duration.ofDays(1)));
            votingService.vote(voter, ballotId, 0);
            assertEquals(1, weightOf(0));
        }

        @Test
        @DisplayName("Summary reports counts and status")
        void summary() {
            votingService.vote(registered("v"), ballotId, 0);
            registered("idle");

            VotingSummary summary = votingService.getVotingSummary(ballotId);
            assertEquals("Budget", summary.getTitle());
            assertEquals(3, summary.getProposalCount());
            assertEquals(3, summary.getRegisteredVoters());
            assertEquals(1, summary.getVotesCast());
            assertTrue(summary.isActive());
            assertFalse(summary.isFinalized());

            clock.setInstant(END.plusSeconds(1));
            assertFalse(votingService.getVotingSummary(ballotId).isActive());
        }
    }
}
