package com.flagship.settlement_engine.ledger;

/**
 * Direction of a journaled balance movement.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
