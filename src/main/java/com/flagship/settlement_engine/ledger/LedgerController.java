package com.flagship.settlement_engine.ledger;

import com.flagship.settlement_engine.host.EngineHost;
import com.flagship.settlement_engine.ledger.dto.BalanceResponse;
import com.flagship.settlement_engine.ledger.dto.CustodyResponse;
import com.flagship.settlement_engine.ledger.dto.DepositRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST endpoints for host funding and balance reads.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private final LedgerService ledgerService;
    private final EngineHost host;

    @PostMapping("/accounts/{accountId}/deposits")
    public ResponseEntity<BalanceResponse> deposit(@PathVariable("accountId") String accountId,
                                                   @Valid @RequestBody DepositRequest request) {
        log.info("Received deposit request: account={}, amount={}", accountId, request.getAmount());
        AccountBalance balance = host.call(() -> ledgerService.deposit(accountId, request.getAmount()));
        return ResponseEntity.status(HttpStatus.CREATED).body(BalanceResponse.from(balance));
    }

    @GetMapping("/accounts/{accountId}")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("accountId") String accountId) {
        return ResponseEntity.ok(BalanceResponse.from(ledgerService.getBalance(accountId)));
    }

    @GetMapping("/accounts/{accountId}/entries")
    public ResponseEntity<List<LedgerEntry>> getEntries(@PathVariable("accountId") String accountId) {
        return ResponseEntity.ok(ledgerService.getEntries(accountId));
    }

    @GetMapping("/custody")
    public ResponseEntity<CustodyResponse> getCustody() {
        return ResponseEntity.ok(new CustodyResponse(
            ledgerService.getCustodyBalance(), ledgerService.getTotalPending()));
    }
}
