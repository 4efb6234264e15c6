package com.flagship.settlement_engine.voting;

import com.flagship.settlement_engine.exception.FailureKind;
import com.flagship.settlement_engine.exception.SettlementException;
import com.flagship.settlement_engine.guard.AccessGuard;
import com.flagship.settlement_engine.guard.ReentrancyGuard;
import com.flagship.settlement_engine.host.EngineCallExecutor;
import com.flagship.settlement_engine.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Voting engine: weighted votes with transitive delegation, one tally per ballot.
 *
 * Each voter starts with weight 1. Delegating hands the voter's whole weight to the end of
 * the delegation chain: onto that voter's chosen proposal if they already voted, onto their
 * weight otherwise. Total weight is conserved across delegations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VotingService {

    private final ReentrancyGuard guard = new ReentrancyGuard("voting");

    private final BallotRepository ballotRepository;
    private final ProposalRepository proposalRepository;
    private final VoterRepository voterRepository;
    private final OutboxService outboxService;
    private final EngineCallExecutor executor;
    private final Clock clock;

    @Value("${settlement.voting.max-delegation-hops:50}")
    private int maxDelegationHops;

    /**
     * Opens a ballot. The chairperson is registered as its first voter and proposes the
     * initial proposals.
     */
    public Ballot createBallot(String chairperson, String title, Instant votingStart, Instant votingEnd,
                               List<ProposalDraft> proposals) {
        return executor.execute(guard, "createBallot", () -> {
            AccessGuard.requireAccount(chairperson, "chairperson");
            if (votingStart == null || votingEnd == null || !votingEnd.isAfter(votingStart)) {
                throw SettlementException.of(FailureKind.INVALID_TIME_RANGE,
                    "start", votingStart, "end", votingEnd);
            }

            Instant now = clock.instant();
            long ballotId = ballotRepository.count();
            BallotEntity ballot = BallotEntity.create(ballotId, title, chairperson, votingStart, votingEnd, now);
            ballotRepository.save(ballot);
            outboxService.saveEvent(new VotingEvents.BallotCreated(ballotId, title, chairperson,
                votingStart, votingEnd));

            registerNewVoter(ballot, chairperson);
            for (ProposalDraft draft : proposals == null ? List.<ProposalDraft>of() : proposals) {
                createProposal(ballot, draft.getName(), draft.getDescription(), chairperson, now);
            }
            ballotRepository.save(ballot);

            log.info("Ballot created: id={}, title={}, chairperson={}, proposals={}",
                ballotId, title, chairperson, proposals == null ? 0 : proposals.size());
            return ballot.toDomain();
        });
    }

    public Voter registerVoter(String caller, long ballotId, String voter) {
        return executor.execute(guard, "registerVoter", () -> {
            BallotEntity ballot = load(ballotId);
            requireChairperson(ballot, caller);
            AccessGuard.requireAccount(voter, "voter");
            requireNotEnded(ballot);
            if (voterRepository.existsByBallotIdAndAccountId(ballotId, voter)) {
                throw SettlementException.of(FailureKind.VOTER_ALREADY_REGISTERED, "voter", voter);
            }

            VoterEntity registered = registerNewVoter(ballot, voter);
            ballotRepository.save(ballot);
            return registered.toDomain();
        });
    }

    /**
     * Registers every new voter in the list. Missing and already registered ids are skipped.
     *
     * @return number of voters registered
     */
    public int registerVotersBatch(String caller, long ballotId, List<String> voters) {
        return executor.execute(guard, "registerVotersBatch", () -> {
            BallotEntity ballot = load(ballotId);
            requireChairperson(ballot, caller);
            requireNotEnded(ballot);

            Set<String> seen = new HashSet<>();
            int registered = 0;
            for (String voter : voters == null ? List.<String>of() : voters) {
                if (voter == null || voter.isBlank() || !seen.add(voter)
                        || voterRepository.existsByBallotIdAndAccountId(ballotId, voter)) {
                    continue;
                }
                registerNewVoter(ballot, voter);
                registered++;
            }
            ballotRepository.save(ballot);

            outboxService.saveEvent(new VotingEvents.VotersBatchRegistered(ballotId, registered));
            log.info("Batch registration: ballot={}, registered={}, submitted={}",
                ballotId, registered, voters == null ? 0 : voters.size());
            return registered;
        });
    }

    public Proposal addProposal(String caller, long ballotId, String name, String description) {
        return executor.execute(guard, "addProposal", () -> {
            BallotEntity ballot = load(ballotId);
            requireChairperson(ballot, caller);
            requireNotEnded(ballot);
            return createProposal(ballot, name, description, caller, clock.instant()).toDomain();
        });
    }

    public Voter vote(String caller, long ballotId, int proposalIndex) {
        return executor.execute(guard, "vote", () -> {
            BallotEntity ballot = load(ballotId);
            VoterEntity voter = loadVoter(ballotId, caller);
            if (voter.isHasVoted()) {
                throw SettlementException.of(FailureKind.ALREADY_VOTED, "voter", caller);
            }
            requireActive(ballot);
            ProposalEntity proposal = loadProposal(ballotId, proposalIndex);

            voter.votedFor(proposalIndex);
            proposal.addWeight(voter.getWeight());
            ballot.voteCast();
            voterRepository.save(voter);
            proposalRepository.save(proposal);
            ballotRepository.save(ballot);

            outboxService.saveEvent(new VotingEvents.VoteCast(ballotId, caller, proposalIndex, voter.getWeight()));
            log.info("Vote cast: ballot={}, voter={}, proposal={}, weight={}",
                ballotId, caller, proposalIndex, voter.getWeight());
            return voter.toDomain();
        });
    }

    /**
     * Hands the caller's weight to {@code to}, following {@code to}'s own delegations.
     * A chain that leads back to the caller, or is longer than the hop limit, fails with
     * {@code DelegationLoopDetected} and leaves every voter untouched.
     */
    public Voter delegate(String caller, long ballotId, String to) {
        return executor.execute(guard, "delegate", () -> {
            BallotEntity ballot = load(ballotId);
            VoterEntity sender = loadVoter(ballotId, caller);
            if (sender.isHasVoted()) {
                throw SettlementException.of(FailureKind.ALREADY_VOTED, "voter", caller);
            }
            AccessGuard.requireAccount(to, "delegate");
            if (to.equals(caller)) {
                throw SettlementException.of(FailureKind.SELF_DELEGATION_NOT_ALLOWED, "voter", caller);
            }
            VoterEntity target = loadVoter(ballotId, to);
            requireActive(ballot);

            int hops = 0;
            while (target.getDelegateId() != null) {
                hops++;
                if (hops > maxDelegationHops || target.getDelegateId().equals(caller)) {
                    throw SettlementException.of(FailureKind.DELEGATION_LOOP_DETECTED,
                        "from", caller, "to", to, "hops", hops);
                }
                target = loadVoter(ballotId, target.getDelegateId());
            }

            sender.delegatedTo(target.getAccountId());
            voterRepository.save(sender);

            if (target.isHasVoted()) {
                ProposalEntity proposal = loadProposal(ballotId, target.getVotedProposal());
                proposal.addWeight(sender.getWeight());
                proposalRepository.save(proposal);
            } else {
                target.receiveWeight(sender.getWeight());
                voterRepository.save(target);
            }

            outboxService.saveEvent(new VotingEvents.VoteDelegated(ballotId, caller, target.getAccountId()));
            log.info("Vote delegated: ballot={}, from={}, to={}, finalDelegate={}, weight={}, hops={}",
                ballotId, caller, to, target.getAccountId(), sender.getWeight(), hops);
            return sender.toDomain();
        });
    }

    /**
     * Closes the tally once the window has passed and records the winning proposal.
     */
    public Proposal finalizeBallot(String caller, long ballotId) {
        return executor.execute(guard, "finalize", () -> {
            BallotEntity ballot = load(ballotId);
            requireChairperson(ballot, caller);
            if (ballot.isFinalized()) {
                throw SettlementException.of(FailureKind.ALREADY_FINALIZED, "ballot", ballotId);
            }
            Instant now = clock.instant();
            if (!ballot.toDomain().hasEnded(now)) {
                throw SettlementException.of(FailureKind.VOTING_STILL_ACTIVE,
                    "now", now, "end", ballot.getVotingEnd());
            }

            ProposalEntity winner = winningProposal(ballotId);
            ballot.finalizeWith(winner.getProposalIndex());
            ballotRepository.save(ballot);

            outboxService.saveEvent(new VotingEvents.VotingFinalized(ballotId, winner.getProposalIndex(),
                winner.getName(), winner.getVoteWeight()));
            log.info("Ballot finalized: id={}, winner={}, name={}, weight={}",
                ballotId, winner.getProposalIndex(), winner.getName(), winner.getVoteWeight());
            return winner.toDomain();
        });
    }

    public Ballot extendVoting(String caller, long ballotId, Instant newEnd) {
        return executor.execute(guard, "extendVoting", () -> {
            BallotEntity ballot = load(ballotId);
            requireChairperson(ballot, caller);
            if (ballot.isFinalized()) {
                throw SettlementException.of(FailureKind.ALREADY_FINALIZED, "ballot", ballotId);
            }
            if (newEnd == null || !newEnd.isAfter(ballot.getVotingEnd())) {
                throw SettlementException.of(FailureKind.INVALID_TIME_RANGE,
                    "currentEnd", ballot.getVotingEnd(), "newEnd", newEnd);
            }

            ballot.extendTo(newEnd);
            ballotRepository.save(ballot);

            outboxService.saveEvent(new VotingEvents.VotingPeriodExtended(ballotId, newEnd));
            log.info("Voting extended: ballot={}, newEnd={}", ballotId, newEnd);
            return ballot.toDomain();
        });
    }

    public Ballot getBallot(long ballotId) {
        return load(ballotId).toDomain();
    }

    /**
     * Proposal with the highest weight; the lowest index wins ties.
     */
    public Proposal getWinningProposal(long ballotId) {
        load(ballotId);
        return winningProposal(ballotId).toDomain();
    }

    public String getWinnerName(long ballotId) {
        return getWinningProposal(ballotId).getName();
    }

    public Proposal getProposal(long ballotId, int proposalIndex) {
        load(ballotId);
        return loadProposal(ballotId, proposalIndex).toDomain();
    }

    public List<Proposal> getProposals(long ballotId) {
        load(ballotId);
        return proposalRepository.findByBallotIdOrderByProposalIndexAsc(ballotId).stream()
            .map(ProposalEntity::toDomain)
            .toList();
    }

    public Voter getVoter(long ballotId, String account) {
        load(ballotId);
        return loadVoter(ballotId, account).toDomain();
    }

    public boolean isRegistered(long ballotId, String account) {
        return account != null && voterRepository.existsByBallotIdAndAccountId(ballotId, account);
    }

    public VotingSummary getVotingSummary(long ballotId) {
        Ballot ballot = load(ballotId).toDomain();
        return new VotingSummary(
            ballot.getTitle(),
            (int) proposalRepository.countByBallotId(ballotId),
            ballot.getTotalVoters(),
            ballot.getTotalVotesCast(),
            !ballot.isFinalized() && ballot.isActive(clock.instant()),
            ballot.isFinalized()
        );
    }

    private VoterEntity registerNewVoter(BallotEntity ballot, String account) {
        VoterEntity voter = voterRepository.save(VoterEntity.register(ballot.getId(), account));
        ballot.voterRegistered();
        outboxService.saveEvent(new VotingEvents.VoterRegistered(ballot.getId(), account));
        log.debug("Voter registered: ballot={}, voter={}", ballot.getId(), account);
        return voter;
    }

    private ProposalEntity createProposal(BallotEntity ballot, String name, String description,
                                          String proposer, Instant now) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Proposal name is required");
        }
        int index = (int) proposalRepository.countByBallotId(ballot.getId());
        ProposalEntity proposal = proposalRepository.save(
            ProposalEntity.create(ballot.getId(), index, name, description, proposer, now));
        outboxService.saveEvent(new VotingEvents.ProposalCreated(ballot.getId(), index, name, proposer));
        log.debug("Proposal created: ballot={}, index={}, name={}", ballot.getId(), index, name);
        return proposal;
    }

    private ProposalEntity winningProposal(long ballotId) {
        ProposalEntity winner = null;
        for (ProposalEntity proposal : proposalRepository.findByBallotIdOrderByProposalIndexAsc(ballotId)) {
            if (winner == null || proposal.getVoteWeight() > winner.getVoteWeight()) {
                winner = proposal;
            }
        }
        if (winner == null) {
            throw SettlementException.of(FailureKind.INVALID_PROPOSAL, "ballot", ballotId, "index", 0);
        }
        return winner;
    }

    private void requireChairperson(BallotEntity ballot, String caller) {
        AccessGuard.requireRole(caller, ballot.getChairpersonId(), FailureKind.NOT_CHAIRPERSON);
    }

    private void requireActive(BallotEntity ballot) {
        Instant now = clock.instant();
        if (!ballot.toDomain().isActive(now)) {
            throw SettlementException.of(FailureKind.VOTING_NOT_ACTIVE,
                "now", now, "start", ballot.getVotingStart(), "end", ballot.getVotingEnd());
        }
    }

    private void requireNotEnded(BallotEntity ballot) {
        Instant now = clock.instant();
        if (ballot.toDomain().hasEnded(now)) {
            throw SettlementException.of(FailureKind.VOTING_NOT_ACTIVE,
                "now", now, "end", ballot.getVotingEnd());
        }
    }

    private BallotEntity load(long ballotId) {
        return ballotRepository.findById(ballotId)
            .orElseThrow(() -> SettlementException.of(FailureKind.BALLOT_NOT_FOUND, "id", ballotId));
    }

    private VoterEntity loadVoter(long ballotId, String account) {
        if (account == null) {
            throw SettlementException.of(FailureKind.VOTER_NOT_REGISTERED, "voter", null);
        }
        return voterRepository.findByBallotIdAndAccountId(ballotId, account)
            .orElseThrow(() -> SettlementException.of(FailureKind.VOTER_NOT_REGISTERED, "voter", account));
    }

    private ProposalEntity loadProposal(long ballotId, int proposalIndex) {
        return proposalRepository.findByBallotIdAndProposalIndex(ballotId, proposalIndex)
            .orElseThrow(() -> SettlementException.of(FailureKind.INVALID_PROPOSAL,
                "ballot", ballotId, "index", proposalIndex));
    }
}
