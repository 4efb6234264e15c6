package com.flagship.settlement_engine.escrow;

import com.flagship.settlement_engine.exception.SettlementException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Escrow agreement between a buyer, a seller and an arbiter.
 *
 * Transitions are explicit and validated; each returns a new instance:
 * <pre>
 * FUNDED   --release--> RELEASED
 * FUNDED   --refund---> REFUNDED
 * FUNDED   --dispute--> DISPUTED
 * DISPUTED --resolve--> RESOLVED
 * </pre>
 * Terminal states reject every transition with {@code InvalidState(current, expected)}.
 */
@Value
public class Escrow {
    long id;
    String buyer;
    String seller;
    String arbiter;
    BigDecimal amount;
    EscrowState state;
    String description;
    Instant createdAt;
    Instant deadline;
    Instant updatedAt;

    /**
     * Creates a funded agreement. The deadline is {@code createdAt + duration}.
     */
    public static Escrow createFunded(long id, String buyer, String seller, String arbiter,
                                      BigDecimal amount, long durationSeconds,
                                      String description, Instant now) {
        return new Escrow(
            id,
            buyer,
            seller,
            arbiter,
            amount,
            EscrowState.FUNDED,
            description,
            now,
            now.plusSeconds(durationSeconds),
            now
        );
    }

    public Escrow release(Instant now) {
        requireState(EscrowState.FUNDED);
        return withState(EscrowState.RELEASED, now);
    }

    public Escrow refund(Instant now) {
        requireState(EscrowState.FUNDED);
        return withState(EscrowState.REFUNDED, now);
    }

    public Escrow dispute(Instant now) {
        requireState(EscrowState.FUNDED);
        return withState(EscrowState.DISPUTED, now);
    }

    public Escrow resolve(Instant now) {
        requireState(EscrowState.DISPUTED);
        return withState(EscrowState.RESOLVED, now);
    }

    /**
     * The buyer may reclaim the funds from the deadline on, inclusive.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(deadline);
    }

    public boolean isParty(String account) {
        return buyer.equals(account) || seller.equals(account);
    }

    public void requireState(EscrowState expected) {
        if (state != expected) {
            throw SettlementException.invalidState(state, expected);
        }
    }

    private Escrow withState(EscrowState next, Instant now) {
        return new Escrow(
            this.id,
            this.buyer,
            this.seller,
            this.arbiter,
            this.amount,
            next,
            this.description,
            this.createdAt,
            this.deadline,
            now
        );
    }
}
