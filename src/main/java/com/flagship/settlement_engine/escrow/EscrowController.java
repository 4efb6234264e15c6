package com.flagship.settlement_engine.escrow;

import com.flagship.settlement_engine.escrow.dto.CreateEscrowRequest;
import com.flagship.settlement_engine.escrow.dto.EscrowResponse;
import com.flagship.settlement_engine.escrow.dto.PlatformResponse;
import com.flagship.settlement_engine.escrow.dto.ResolveDisputeRequest;
import com.flagship.settlement_engine.host.EngineHost;
import com.flagship.settlement_engine.ledger.dto.WithdrawalResponse;
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

import java.math.BigDecimal;
import java.util.Map;

import static com.flagship.settlement_engine.observability.CorrelationContext.CALLER_HEADER;

/**
 * REST endpoints for the escrow engine. The caller principal comes from {@code X-Caller-Id}.
 */
@RestController
@RequestMapping("/api/escrows")
@RequiredArgsConstructor
@Slf4j
public class EscrowController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final EscrowService escrowService;
    private final EngineHost host;

    @PostMapping
    public ResponseEntity<EscrowResponse> createEscrow(
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody CreateEscrowRequest request) {

        log.info("Received escrow creation request: buyer={}, seller={}, amount={}, idempotencyKey={}",
                caller, request.getSeller(), request.getAmount(), idempotencyKey);

        Escrow escrow = host.call(() -> escrowService.createEscrow(
                caller,
                request.getSeller(),
                request.getArbiter(),
                request.getDurationSeconds(),
                request.getDescription(),
                request.getAmount(),
                idempotencyKey));

        return ResponseEntity.status(HttpStatus.CREATED).body(EscrowResponse.from(escrow));
    }

    @GetMapping("/{id}")
    public ResponseEntity<EscrowResponse> getEscrow(@PathVariable("id") long id) {
        return ResponseEntity.ok(EscrowResponse.from(escrowService.getEscrow(id)));
    }

    @GetMapping("/{id}/expired")
    public ResponseEntity<Map<String, Object>> isExpired(@PathVariable("id") long id) {
        return ResponseEntity.ok(Map.of("id", id, "expired", escrowService.isExpired(id)));
    }

    @PostMapping("/{id}/release")
    public ResponseEntity<EscrowResponse> release(@RequestHeader(CALLER_HEADER) String caller,
                                                  @PathVariable("id") long id) {
        return ResponseEntity.ok(EscrowResponse.from(host.call(() -> escrowService.release(caller, id))));
    }

    @PostMapping("/{id}/refund")
    public ResponseEntity<EscrowResponse> refund(@RequestHeader(CALLER_HEADER) String caller,
                                                 @PathVariable("id") long id) {
        return ResponseEntity.ok(EscrowResponse.from(host.call(() -> escrowService.refund(caller, id))));
    }

    @PostMapping("/{id}/dispute")
    public ResponseEntity<EscrowResponse> raiseDispute(@RequestHeader(CALLER_HEADER) String caller,
                                                       @PathVariable("id") long id) {
        return ResponseEntity.ok(EscrowResponse.from(host.call(() -> escrowService.raiseDispute(caller, id))));
    }

    @PostMapping("/{id}/resolution")
    public ResponseEntity<EscrowResponse> resolveDispute(@RequestHeader(CALLER_HEADER) String caller,
                                                         @PathVariable("id") long id,
                                                         @RequestBody ResolveDisputeRequest request) {
        Escrow escrow = host.call(() -> escrowService.resolveDispute(caller, id, request.getRecipient()));
        return ResponseEntity.ok(EscrowResponse.from(escrow));
    }

    @PostMapping("/withdrawals")
    public ResponseEntity<WithdrawalResponse> withdraw(@RequestHeader(CALLER_HEADER) String caller) {
        BigDecimal amount = host.call(() -> escrowService.withdraw(caller));
        return ResponseEntity.ok(new WithdrawalResponse(caller, amount));
    }

    @PostMapping("/platform-fees/withdrawals")
    public ResponseEntity<WithdrawalResponse> withdrawPlatformFees(@RequestHeader(CALLER_HEADER) String caller) {
        BigDecimal amount = host.call(() -> escrowService.withdrawPlatformFees(caller));
        return ResponseEntity.ok(new WithdrawalResponse(caller, amount));
    }

    @GetMapping("/platform")
    public ResponseEntity<PlatformResponse> getPlatform() {
        return ResponseEntity.ok(new PlatformResponse(
                escrowService.getPlatformOwner(),
                escrowService.getPlatformFeeBps(),
                escrowService.getPlatformBalance(),
                escrowService.getEscrowCount()));
    }
}
