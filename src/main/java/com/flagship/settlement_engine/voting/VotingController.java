package com.flagship.settlement_engine.voting;

import com.flagship.settlement_engine.host.EngineHost;
import com.flagship.settlement_engine.voting.dto.BallotResponse;
import com.flagship.settlement_engine.voting.dto.CreateBallotRequest;
import com.flagship.settlement_engine.voting.dto.DelegationRequest;
import com.flagship.settlement_engine.voting.dto.ExtensionRequest;
import com.flagship.settlement_engine.voting.dto.ProposalRequest;
import com.flagship.settlement_engine.voting.dto.ProposalResponse;
import com.flagship.settlement_engine.voting.dto.VoteRequest;
import com.flagship.settlement_engine.voting.dto.VoterBatchRequest;
import com.flagship.settlement_engine.voting.dto.VoterRequest;
import com.flagship.settlement_engine.voting.dto.VoterResponse;
import com.flagship.settlement_engine.voting.dto.VotingSummaryResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

import static com.flagship.settlement_engine.observability.CorrelationContext.CALLER_HEADER;

@RestController
@RequestMapping("/api/ballots")
@RequiredArgsConstructor
@Slf4j
public class VotingController {

    private final VotingService votingService;
    private final EngineHost host;

    @PostMapping
    public ResponseEntity<BallotResponse> createBallot(@RequestHeader(CALLER_HEADER) String caller,
                                                       @Valid @RequestBody CreateBallotRequest request) {
        log.info("Received ballot creation request: chairperson={}, title={}", caller, request.getTitle());

        List<ProposalDraft> drafts = request.getProposals() == null ? List.of()
            : request.getProposals().stream()
                .map(p -> new ProposalDraft(p.getName(), p.getDescription()))
                .toList();

        Ballot ballot = host.call(() -> votingService.createBallot(
            caller, request.getTitle(), request.getVotingStart(), request.getVotingEnd(), drafts));

        return ResponseEntity.status(HttpStatus.CREATED).body(BallotResponse.from(ballot));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BallotResponse> getBallot(@PathVariable("id") long id) {
        return ResponseEntity.ok(BallotResponse.from(votingService.getBallot(id)));
    }

    @PostMapping("/{id}/voters")
    public ResponseEntity<VoterResponse> registerVoter(@RequestHeader(CALLER_HEADER) String caller,
                                                       @PathVariable("id") long id,
                                                       @RequestBody VoterRequest request) {
        Voter voter = host.call(() -> votingService.registerVoter(caller, id, request.getVoter()));
        return ResponseEntity.status(HttpStatus.CREATED).body(VoterResponse.from(voter));
    }

    @PostMapping("/{id}/voters/batch")
    public ResponseEntity<Map<String, Object>> registerVotersBatch(@RequestHeader(CALLER_HEADER) String caller,
                                                                   @PathVariable("id") long id,
                                                                   @RequestBody VoterBatchRequest request) {
        int registered = host.call(() -> votingService.registerVotersBatch(caller, id, request.getVoters()));
        return ResponseEntity.ok(Map.of("ballot_id", id, "registered", registered));
    }

    @GetMapping("/{id}/voters/{account}")
    public ResponseEntity<VoterResponse> getVoter(@PathVariable("id") long id,
                                                  @PathVariable("account") String account) {
        return ResponseEntity.ok(VoterResponse.from(votingService.getVoter(id, account)));
    }

    @PostMapping("/{id}/proposals")
    public ResponseEntity<ProposalResponse> addProposal(@RequestHeader(CALLER_HEADER) String caller,
                                                        @PathVariable("id") long id,
                                                        @Valid @RequestBody ProposalRequest request) {
        Proposal proposal = host.call(() ->
            votingService.addProposal(caller, id, request.getName(), request.getDescription()));
        return ResponseEntity.status(HttpStatus.CREATED).body(ProposalResponse.from(proposal));
    }

    @GetMapping("/{id}/proposals")
    public ResponseEntity<List<ProposalResponse>> getProposals(@PathVariable("id") long id) {
        return ResponseEntity.ok(votingService.getProposals(id).stream().map(ProposalResponse::from).toList());
    }

    @GetMapping("/{id}/proposals/{index}")
    public ResponseEntity<ProposalResponse> getProposal(@PathVariable("id") long id,
                                                        @PathVariable("index") int index) {
        return ResponseEntity.ok(ProposalResponse.from(votingService.getProposal(id, index)));
    }

    @PostMapping("/{id}/votes")
    public ResponseEntity<VoterResponse> vote(@RequestHeader(CALLER_HEADER) String caller,
                                              @PathVariable("id") long id,
                                              @Valid @RequestBody VoteRequest request) {
        Voter voter = host.call(() -> votingService.vote(caller, id, request.getProposal()));
        return ResponseEntity.ok(VoterResponse.from(voter));
    }

    @PostMapping("/{id}/delegations")
    public ResponseEntity<VoterResponse> delegate(@RequestHeader(CALLER_HEADER) String caller,
                                                  @PathVariable("id") long id,
                                                  @RequestBody DelegationRequest request) {
        Voter voter = host.call(() -> votingService.delegate(caller, id, request.getTo()));
        return ResponseEntity.ok(VoterResponse.from(voter));
    }

    @PostMapping("/{id}/finalization")
    public ResponseEntity<ProposalResponse> finalizeBallot(@RequestHeader(CALLER_HEADER) String caller,
                                                           @PathVariable("id") long id) {
        Proposal winner = host.call(() -> votingService.finalizeBallot(caller, id));
        return ResponseEntity.ok(ProposalResponse.from(winner));
    }

    @PostMapping("/{id}/extension")
    public ResponseEntity<BallotResponse> extendVoting(@RequestHeader(CALLER_HEADER) String caller,
                                                       @PathVariable("id") long id,
                                                       @Valid @RequestBody ExtensionRequest request) {
        Ballot ballot = host.call(() -> votingService.extendVoting(caller, id, request.getNewEnd()));
        return ResponseEntity.ok(BallotResponse.from(ballot));
    }

    @GetMapping("/{id}/winner")
    public ResponseEntity<ProposalResponse> getWinner(@PathVariable("id") long id) {
        return ResponseEntity.ok(ProposalResponse.from(votingService.getWinningProposal(id)));
    }

    @GetMapping("/{id}/summary")
    public ResponseEntity<VotingSummaryResponse> getSummary(@PathVariable("id") long id) {
        return ResponseEntity.ok(VotingSummaryResponse.from(votingService.getVotingSummary(id)));
    }
}
