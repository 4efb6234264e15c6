package com.flagship.settlement_engine.escrow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.settlement_engine.ledger.LedgerService;
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

import java.math.BigDecimal;
import java.util.Map;

import static com.flagship.settlement_engine.observability.CorrelationContext.CALLER_HEADER;
import static com.flagship.settlement_engine.support.TestAccounts.unique;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestClockConfig.class)
class EscrowControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private MutableClock clock;

    private String buyer;
    private String seller;
    private String arbiter;

    @BeforeEach
    void setUp() {
        clock.setInstant(TestClockConfig.START);
        buyer = unique("buyer");
        seller = unique("seller");
        arbiter = unique("arbiter");
        ledgerService.deposit(buyer, new BigDecimal("1000"));
    }

    private String createBody(String amount) throws Exception {
        return objectMapper.writeValueAsString(Map.of(
            "seller", seller,
            "arbiter", arbiter,
            "duration_seconds", 86_400,
            "description", "Laptop",
            "amount", new BigDecimal(amount)));
    }

    private long createEscrow(String amount) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/escrows")
                .header(CALLER_HEADER, buyer)
                .contentType(MediaType.APPLICATION_JSON)
                .content(createBody(amount)))
            .andExpect(status().isCreated())
            .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("id").asLong();
    }

    private JsonNode json(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    @DisplayName("POST creates a funded escrow for the calling buyer")
    void createEscrow() throws Exception {
        mockMvc.perform(post("/api/escrows")
                .header(CALLER_HEADER, buyer)
                .contentType(MediaType.APPLICATION_JSON)
                .content(createBody("250")))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.buyer").value(buyer))
            .andExpect(jsonPath("$.seller").value(seller))
            .andExpect(jsonPath("$.state").value("FUNDED"));
    }

    @Test
    @DisplayName("The same idempotency key returns the same escrow")
    void idempotentCreate() throws Exception {
        String key = unique("key");
        long first = json(mockMvc.perform(post("/api/escrows")
                .header(CALLER_HEADER, buyer)
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(createBody("100")))
            .andExpect(status().isCreated())
            .andReturn()).get("id").asLong();

        long second = json(mockMvc.perform(post("/api/escrows")
                .header(CALLER_HEADER, buyer)
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(createBody("100")))
            .andExpect(status().isCreated())
            .andReturn()).get("id").asLong();

        assertEquals(first, second);
        assertEquals(0, new BigDecimal("900").compareTo(ledgerService.getBalance(buyer).getAvailable()));
    }

    @Test
    @DisplayName("Missing caller header is rejected with 400")
    void missingCaller() throws Exception {
        mockMvc.perform(post("/api/escrows")
                .contentType(MediaType.APPLICATION_JSON)
                .content(createBody("100")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("MissingRequiredHeader"));
    }

    @Test
    @DisplayName("Missing amount fails validation")
    void missingAmount() throws Exception {
        mockMvc.perform(post("/api/escrows")
                .header(CALLER_HEADER, buyer)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of(
                    "seller", seller, "arbiter", arbiter, "duration_seconds", 86_400))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("ValidationFailed"));
    }

    @Test
    @DisplayName("Amount above the buyer's balance is rejected with 400")
    void insufficientFunds() throws Exception {
        mockMvc.perform(post("/api/escrows")
                .header(CALLER_HEADER, buyer)
                .contentType(MediaType.APPLICATION_JSON)
                .content(createBody("5000")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("InsufficientFunds"));
    }

    @Test
    @DisplayName("Release by the buyer, then withdraw by the seller")
    void releaseAndWithdraw() throws Exception {
        long id = createEscrow("100");

        mockMvc.perform(post("/api/escrows/{id}/release", id).header(CALLER_HEADER, buyer))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("RELEASED"));

        JsonNode withdrawal = json(mockMvc.perform(post("/api/escrows/withdrawals").header(CALLER_HEADER, seller))
            .andExpect(status().isOk())
            .andReturn());
        assertEquals(seller, withdrawal.get("account_id").asText());
        assertEquals(0, new BigDecimal("99").compareTo(withdrawal.get("amount").decimalValue()));
    }

    @Test
    @DisplayName("Release by an outsider is 403, a second release is 409")
    void releaseErrors() throws Exception {
        long id = createEscrow("100");

        mockMvc.perform(post("/api/escrows/{id}/release", id).header(CALLER_HEADER, seller))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("Unauthorized"));

        mockMvc.perform(post("/api/escrows/{id}/release", id).header(CALLER_HEADER, buyer))
            .andExpect(status().isOk());

        mockMvc.perform(post("/api/escrows/{id}/release", id).header(CALLER_HEADER, buyer))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("InvalidState"));
    }

    @Test
    @DisplayName("Dispute then resolution by the arbiter")
    void disputeFlow() throws Exception {
        long id = createEscrow("100");

        mockMvc.perform(post("/api/escrows/{id}/dispute", id).header(CALLER_HEADER, seller))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("DISPUTED"));

        mockMvc.perform(post("/api/escrows/{id}/resolution", id)
                .header(CALLER_HEADER, arbiter)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("recipient", buyer))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("RESOLVED"));

        assertEquals(0, new BigDecimal("99").compareTo(ledgerService.getBalance(buyer).getPendingWithdrawal()));
    }

    @Test
    @DisplayName("Unknown escrow is 404, withdraw with nothing pending is 422")
    void notFoundAndNoFunds() throws Exception {
        mockMvc.perform(get("/api/escrows/{id}", 9_999_999))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("EscrowNotFound"));

        mockMvc.perform(post("/api/escrows/withdrawals").header(CALLER_HEADER, unique("nobody")))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("NoPendingWithdrawals"));
    }

    @Test
    @DisplayName("Platform view reports the configured owner and fee")
    void platform() throws Exception {
        mockMvc.perform(get("/api/escrows/platform"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.owner").value("escrow-platform"))
            .andExpect(jsonPath("$.fee_bps").value(100));
    }
}
