package com.flagship.settlement_engine.ledger;

/**
 * Which balance a ledger entry moved.
 */
public enum Bucket {
    /** Spendable native balance, outside the engine. */
    AVAILABLE,
    /** Credited to the account, waiting for a pull withdrawal. */
    PENDING,
    /** Value held by the engine. */
    CUSTODY
}
