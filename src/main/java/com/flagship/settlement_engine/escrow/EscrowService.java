package com.flagship.settlement_engine.escrow;

import com.flagship.settlement_engine.exception.FailureKind;
import com.flagship.settlement_engine.exception.SettlementException;
import com.flagship.settlement_engine.guard.AccessGuard;
import com.flagship.settlement_engine.guard.ReentrancyGuard;
import com.flagship.settlement_engine.host.EngineCallExecutor;
import com.flagship.settlement_engine.ledger.Amounts;
import com.flagship.settlement_engine.ledger.LedgerAccounts;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import com.flagship.settlement_engine.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Escrow engine: two-party agreements with an arbiter for disputes.
 *
 * Funds are collected into custody when the agreement is created. Every payout is a
 * pending credit that the recipient pulls with {@link #withdraw(String)}; the agreement's
 * state is stored before any credit is made.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowService {

    private final ReentrancyGuard guard = new ReentrancyGuard("escrow");

    private final EscrowRepository escrowRepository;
    private final LedgerAccounts ledger;
    private final OutboxService outboxService;
    private final IdempotencyService idempotencyService;
    private final EngineCallExecutor executor;
    private final SettlementMetrics metrics;
    private final Clock clock;

    @Value("${settlement.escrow.platform-owner:escrow-platform}")
    private String platformOwner;

    @Value("${settlement.escrow.fee-bps:100}")
    private int platformFeeBps;

    @Value("${settlement.escrow.min-duration-seconds:86400}")
    private long minDurationSeconds;

    @Value("${settlement.escrow.max-duration-seconds:315360000}")
    private long maxDurationSeconds;

    public Escrow createEscrow(String buyer, String seller, String arbiter, long durationSeconds,
                               String description, BigDecimal amount) {
        return createEscrow(buyer, seller, arbiter, durationSeconds, description, amount, null);
    }

    /**
     * Creates and funds an agreement. The caller is the buyer; {@code amount} is collected
     * from the buyer's available balance.
     *
     * @param idempotencyKey optional; the same buyer repeating a key gets back the agreement it created
     */
    public Escrow createEscrow(String buyer, String seller, String arbiter, long durationSeconds,
                               String description, BigDecimal amount, String idempotencyKey) {
        Escrow escrow = executor.execute(guard, "createEscrow", () -> {
            AccessGuard.requireAccount(buyer, "buyer");
            if (idempotencyKey != null) {
                Optional<Long> existingId = idempotencyService.checkIdempotencyKey(buyer, idempotencyKey);
                if (existingId.isPresent()) {
                    metrics.recordIdempotencyHit();
                    log.info("Idempotency key already used, returning escrow {}", existingId.get());
                    return load(existingId.get()).toDomain();
                }
                metrics.recordIdempotencyMiss();
            }

            BigDecimal value = Amounts.requirePositive(amount);
            AccessGuard.requireAccount(seller, "seller");
            AccessGuard.requireAccount(arbiter, "arbiter");
            if (durationSeconds < minDurationSeconds || durationSeconds > maxDurationSeconds) {
                throw SettlementException.of(FailureKind.INVALID_DEADLINE,
                    "duration", durationSeconds, "minimum", minDurationSeconds, "maximum", maxDurationSeconds);
            }

            long escrowId = escrowRepository.count();
            Escrow created = Escrow.createFunded(escrowId, buyer, seller, arbiter, value,
                durationSeconds, description, clock.instant());

            escrowRepository.save(EscrowEntity.fromDomain(created, idempotencyKey));
            ledger.collect(buyer, value, "Escrow #" + escrowId + " funding");

            outboxService.saveEvent(new EscrowEvents.EscrowCreated(escrowId, buyer, seller, arbiter,
                value, created.getDeadline(), description));
            outboxService.saveEvent(new EscrowEvents.EscrowFunded(escrowId, buyer, value));
            metrics.recordValueMoved("escrow_funding", value);

            log.info("Escrow created: id={}, buyer={}, seller={}, amount={}, deadline={}",
                escrowId, buyer, seller, value, created.getDeadline());
            return created;
        });

        if (idempotencyKey != null) {
            idempotencyService.storeIdempotencyKey(buyer, idempotencyKey, escrow.getId());
        }
        return escrow;
    }

    /**
     * Buyer accepts delivery: seller is credited the amount less the platform fee.
     */
    public Escrow release(String caller, long escrowId) {
        return executor.execute(guard, "release", () -> {
            EscrowEntity entity = load(escrowId);
            Escrow escrow = entity.toDomain();
            AccessGuard.requireCaller(caller, escrow.getBuyer(), "buyer");

            Escrow released = escrow.release(clock.instant());
            entity.updateFromDomain(released);
            escrowRepository.save(entity);

            BigDecimal fee = Amounts.bps(escrow.getAmount(), platformFeeBps);
            BigDecimal sellerAmount = escrow.getAmount().subtract(fee);
            creditIfPositive(escrow.getSeller(), sellerAmount, "Escrow #" + escrowId + " release");
            creditIfPositive(platformOwner, fee, "Escrow #" + escrowId + " platform fee");

            outboxService.saveEvent(new EscrowEvents.EscrowReleased(escrowId, sellerAmount, fee));
            log.info("Escrow released: id={}, sellerAmount={}, fee={}", escrowId, sellerAmount, fee);
            return released;
        });
    }

    /**
     * Returns the full amount to the buyer. The seller may refund at any time while funded;
     * the buyer only once the deadline has been reached.
     */
    public Escrow refund(String caller, long escrowId) {
        return executor.execute(guard, "refund", () -> {
            EscrowEntity entity = load(escrowId);
            Escrow escrow = entity.toDomain();
            AccessGuard.requireOneOf(caller, List.of(escrow.getBuyer(), escrow.getSeller()), "buyer or seller");
            escrow.requireState(EscrowState.FUNDED);

            Instant now = clock.instant();
            if (!caller.equals(escrow.getSeller()) && !escrow.isExpired(now)) {
                throw SettlementException.of(FailureKind.DEADLINE_NOT_REACHED,
                    "now", now, "deadline", escrow.getDeadline());
            }

            Escrow refunded = escrow.refund(now);
            entity.updateFromDomain(refunded);
            escrowRepository.save(entity);

            ledger.credit(escrow.getBuyer(), escrow.getAmount(), "Escrow #" + escrowId + " refund");

            outboxService.saveEvent(new EscrowEvents.EscrowRefunded(escrowId, escrow.getAmount()));
            log.info("Escrow refunded: id={}, by={}, amount={}", escrowId, caller, escrow.getAmount());
            return refunded;
        });
    }

    public Escrow raiseDispute(String caller, long escrowId) {
        return executor.execute(guard, "raiseDispute", () -> {
            EscrowEntity entity = load(escrowId);
            Escrow escrow = entity.toDomain();
            AccessGuard.requireOneOf(caller, List.of(escrow.getBuyer(), escrow.getSeller()), "buyer or seller");

            Escrow disputed = escrow.dispute(clock.instant());
            entity.updateFromDomain(disputed);
            escrowRepository.save(entity);

            outboxService.saveEvent(new EscrowEvents.DisputeRaised(escrowId, caller));
            log.info("Dispute raised: id={}, by={}", escrowId, caller);
            return disputed;
        });
    }

    /**
     * Arbiter decides a dispute in favour of the buyer or the seller. The platform fee
     * applies either way.
     */
    public Escrow resolveDispute(String caller, long escrowId, String recipient) {
        return executor.execute(guard, "resolveDispute", () -> {
            EscrowEntity entity = load(escrowId);
            Escrow escrow = entity.toDomain();
            AccessGuard.requireCaller(caller, escrow.getArbiter(), "arbiter");
            escrow.requireState(EscrowState.DISPUTED);
            if (recipient == null || !escrow.isParty(recipient)) {
                throw SettlementException.unauthorized(recipient, "buyer or seller");
            }

            Escrow resolved = escrow.resolve(clock.instant());
            entity.updateFromDomain(resolved);
            escrowRepository.save(entity);

            BigDecimal fee = Amounts.bps(escrow.getAmount(), platformFeeBps);
            BigDecimal recipientAmount = escrow.getAmount().subtract(fee);
            creditIfPositive(recipient, recipientAmount, "Escrow #" + escrowId + " dispute resolution");
            creditIfPositive(platformOwner, fee, "Escrow #" + escrowId + " platform fee");

            outboxService.saveEvent(new EscrowEvents.DisputeResolved(escrowId, recipient, recipientAmount));
            log.info("Dispute resolved: id={}, recipient={}, amount={}, fee={}",
                escrowId, recipient, recipientAmount, fee);
            return resolved;
        });
    }

    public BigDecimal withdrawPlatformFees(String caller) {
        return executor.execute(guard, "withdrawPlatformFees", () -> {
            AccessGuard.requireCaller(caller, platformOwner, "platformOwner");
            BigDecimal pending = ledger.getPendingWithdrawal(platformOwner);
            if (pending.signum() <= 0) {
                throw SettlementException.of(FailureKind.INVALID_AMOUNT, "amount", pending);
            }

            BigDecimal amount = ledger.withdraw(platformOwner);

            outboxService.saveEvent(new EscrowEvents.PlatformFeesWithdrawn(platformOwner, amount));
            metrics.recordValueMoved("escrow_platform_withdrawal", amount);
            log.info("Platform fees withdrawn: owner={}, amount={}", platformOwner, amount);
            return amount;
        });
    }

    /**
     * Pulls the caller's pending credits.
     */
    public BigDecimal withdraw(String caller) {
        return executor.execute(guard, "withdraw", () -> {
            AccessGuard.requireAccount(caller, "caller");
            BigDecimal amount = ledger.withdraw(caller);

            outboxService.saveEvent(new EscrowEvents.FundsWithdrawn(caller, amount));
            metrics.recordValueMoved("escrow_withdrawal", amount);
            log.info("Escrow withdrawal: account={}, amount={}", caller, amount);
            return amount;
        });
    }

    public Escrow getEscrow(long escrowId) {
        return load(escrowId).toDomain();
    }

    public boolean isExpired(long escrowId) {
        return getEscrow(escrowId).isExpired(clock.instant());
    }

    public long getEscrowCount() {
        return escrowRepository.count();
    }

    public BigDecimal getPlatformBalance() {
        return ledger.getPendingWithdrawal(platformOwner);
    }

    public String getPlatformOwner() {
        return platformOwner;
    }

    public int getPlatformFeeBps() {
        return platformFeeBps;
    }

    private EscrowEntity load(long escrowId) {
        return escrowRepository.findById(escrowId)
            .orElseThrow(() -> SettlementException.of(FailureKind.ESCROW_NOT_FOUND, "id", escrowId));
    }

    private void creditIfPositive(String account, BigDecimal amount, String description) {
        if (amount.signum() > 0) {
            ledger.credit(account, amount, description);
        }
    }
}
