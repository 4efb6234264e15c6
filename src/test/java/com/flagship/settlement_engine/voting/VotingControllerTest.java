package com.flagship.settlement_engine.voting;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.settlement_engine.support.MutableClock;
import com.flagship.settlement_engine.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.flagship.settlement_engine.observability.CorrelationContext.CALLER_HEADER;
import static com.flagship.settlement_engine.support.TestAccounts.unique;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestClockConfig.class)
class VotingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MutableClock clock;

    private String chair;
    private String alice;
    private String bob;

    @BeforeEach
    void setUp() {
        clock.setInstant(TestClockConfig.START);
        chair = unique("chair");
        alice = unique("alice");
        bob = unique("bob");
    }

    private long createBallot() throws Exception {
        String body = objectMapper.writeValueAsString(Map.of(
            "title", "Budget",
            "voting_start", TestClockConfig.START.toString(),
            "voting_end", TestClockConfig.START.plus(Duration.ofDays(1)).toString(),
            "proposals", List.of(
                Map.of("name", "Parks", "description", "More trees"),
                Map.of("name", "Roads", "description", "Fewer potholes"))));

        MvcResult result = mockMvc.perform(post("/api/ballots")
                .header(CALLER_HEADER, chair)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.chairperson").value(chair))
            .andExpect(jsonPath("$.finalized").value(false))
            .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("id").asLong();
    }

    private void registerVoters(long id, String... voters) throws Exception {
        mockMvc.perform(post("/api/ballots/{id}/voters/batch", id)
                .header(CALLER_HEADER, chair)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("voters", List.of(voters)))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.registered").value(voters.length));
    }

    @Test
    @DisplayName("Ballot lifecycle: register, vote, delegate, finalize")
    void lifecycle() throws Exception {
        long id = createBallot();
        registerVoters(id, alice, bob);

        mockMvc.perform(get("/api/ballots/{id}/proposals", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[1].name").value("Roads"));

        mockMvc.perform(post("/api/ballots/{id}/delegations", id)
                .header(CALLER_HEADER, bob)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("to", alice))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.voted").value(true))
            .andExpect(jsonPath("$.delegate").value(alice));

        mockMvc.perform(post("/api/ballots/{id}/votes", id)
                .header(CALLER_HEADER, alice)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("proposal", 1))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.weight").value(2))
            .andExpect(jsonPath("$.voted_proposal").value(1));

        clock.advance(Duration.ofDays(2));

        mockMvc.perform(post("/api/ballots/{id}/finalization", id).header(CALLER_HEADER, chair))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.index").value(1))
            .andExpect(jsonPath("$.vote_weight").value(2));

        mockMvc.perform(get("/api/ballots/{id}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.finalized").value(true))
            .andExpect(jsonPath("$.winning_proposal").value(1));
    }

    @Test
    @DisplayName("Only the chairperson registers voters")
    void registrationByOutsider() throws Exception {
        long id = createBallot();

        mockMvc.perform(post("/api/ballots/{id}/voters", id)
                .header(CALLER_HEADER, alice)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("voter", bob))))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("NotChairperson"));
    }

    @Test
    @DisplayName("Voting twice is 409, an unregistered voter is 409")
    void voteErrors() throws Exception {
        long id = createBallot();
        registerVoters(id, alice);
        String vote = objectMapper.writeValueAsString(Map.of("proposal", 0));

        mockMvc.perform(post("/api/ballots/{id}/votes", id)
                .header(CALLER_HEADER, alice).contentType(MediaType.APPLICATION_JSON).content(vote))
            .andExpect(status().isOk());

        mockMvc.perform(post("/api/ballots/{id}/votes", id)
                .header(CALLER_HEADER, alice).contentType(MediaType.APPLICATION_JSON).content(vote))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("AlreadyVoted"));

        mockMvc.perform(post("/api/ballots/{id}/votes", id)
                .header(CALLER_HEADER, bob).contentType(MediaType.APPLICATION_JSON).content(vote))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("VoterNotRegistered"));
    }

    @Test
    @DisplayName("Delegation loop is 422, unknown proposal and ballot are 404")
    void integrityAndNotFound() throws Exception {
        long id = createBallot();
        registerVoters(id, alice, bob);

        mockMvc.perform(post("/api/ballots/{id}/delegations", id)
                .header(CALLER_HEADER, alice).contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("to", bob))))
            .andExpect(status().isOk());

        mockMvc.perform(post("/api/ballots/{id}/delegations", id)
                .header(CALLER_HEADER, bob).contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("to", alice))))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("DelegationLoopDetected"));

        mockMvc.perform(get("/api/ballots/{id}/proposals/{index}", id, 7))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("InvalidProposal"));

        mockMvc.perform(get("/api/ballots/{id}", 9_999_999))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("BallotNotFound"));
    }

    @Test
    @DisplayName("Finalizing during the voting period is 409")
    void finalizeTooEarly() throws Exception {
        long id = createBallot();

        mockMvc.perform(post("/api/ballots/{id}/finalization", id).header(CALLER_HEADER, chair))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("VotingStillActive"));
    }

    @Test
    @DisplayName("Summary reports counts and activity")
    void summary() throws Exception {
        long id = createBallot();
        registerVoters(id, alice, bob);

        mockMvc.perform(get("/api/ballots/{id}/summary", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.title").value("Budget"))
            .andExpect(jsonPath("$.proposal_count").value(2))
            .andExpect(jsonPath("$.registered_voters").value(2))
            .andExpect(jsonPath("$.votes_cast").value(0))
            .andExpect(jsonPath("$.active").value(true));
    }
}
