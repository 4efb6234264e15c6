package com.flagship.settlement_engine;

import com.flagship.settlement_engine.escrow.Escrow;
import com.flagship.settlement_engine.escrow.EscrowService;
import com.flagship.settlement_engine.ledger.LedgerService;
import com.flagship.settlement_engine.marketplace.MarketplaceService;
import com.flagship.settlement_engine.marketplace.Sale;
import com.flagship.settlement_engine.outbox.EventAggregates;
import com.flagship.settlement_engine.outbox.OutboxService;
import com.flagship.settlement_engine.support.TestClockConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;

import static com.flagship.settlement_engine.support.TestAccounts.unique;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the settlement flows against a real PostgreSQL instance, checking the schema and the
 * row locking used by the ledger. Skipped when Docker is not available.
 */
@SpringBootTest
@Import(TestClockConfig.class)
@Testcontainers(disabledWithoutDocker = true)
class PostgresSettlementTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("settlement_engine_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private EscrowService escrowService;

    @Autowired
    private MarketplaceService marketplaceService;

    @Autowired
    private OutboxService outboxService;

    @Test
    @DisplayName("Escrow release settles through the pull-payment ledger")
    void escrowRelease() {
        String buyer = unique("buyer");
        String seller = unique("seller");
        ledgerService.deposit(buyer, new BigDecimal("500"));

        Escrow escrow = escrowService.createEscrow(buyer, seller, unique("arbiter"), 86_400, "goods",
            new BigDecimal("200"));
        escrowService.release(buyer, escrow.getId());

        assertEquals(0, new BigDecimal("198").compareTo(escrowService.withdraw(seller)));
        assertEquals(3, outboxService.getEventsForAggregate(EventAggregates.ESCROW,
            String.valueOf(escrow.getId())).size());
    }

    @Test
    @DisplayName("Secondary sale pays fee, royalty and proceeds")
    void secondarySale() {
        String creator = unique("creator");
        String collector = unique("collector");
        String buyer = unique("buyer");
        ledgerService.deposit(collector, new BigDecimal("1000"));
        ledgerService.deposit(buyer, new BigDecimal("1000"));

        long tokenId = marketplaceService.mint(creator, "ipfs://piece").getTokenId();
        marketplaceService.listItem(creator, tokenId, new BigDecimal("100"));
        marketplaceService.buyItem(collector, tokenId, new BigDecimal("100"));
        marketplaceService.listItem(collector, tokenId, new BigDecimal("200"));

        Sale sale = marketplaceService.buyItem(buyer, tokenId, new BigDecimal("200"));

        assertEquals(0, new BigDecimal("5").compareTo(sale.getSplit().getPlatformFee()));
        assertEquals(0, new BigDecimal("10").compareTo(sale.getSplit().getRoyalty()));
        assertEquals(0, new BigDecimal("185").compareTo(sale.getSplit().getSellerProceeds()));
        assertEquals(0, new BigDecimal("108").compareTo(marketplaceService.getPendingWithdrawal(creator)));
    }
}
