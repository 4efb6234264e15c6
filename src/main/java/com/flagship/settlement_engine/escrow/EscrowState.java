package com.flagship.settlement_engine.escrow;

/**
 * Lifecycle of an escrow agreement.
 *
 * CREATED and FUNDED collapse into one step: an agreement is funded in the call that
 * creates it, so stored agreements start in FUNDED.
 */
public enum EscrowState {
    CREATED,
    FUNDED,
    RELEASED,
    REFUNDED,
    DISPUTED,
    RESOLVED;

    public boolean isTerminal() {
        return this == RELEASED || this == REFUNDED || this == RESOLVED;
    }
}
