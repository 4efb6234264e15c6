package com.flagship.settlement_engine.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One journaled balance movement. Entries are immutable once written.
 */
@Value
public class LedgerEntry {
    Long sequenceNumber;
    String accountId;
    Bucket bucket;
    EntryType entryType;
    BigDecimal amount;
    String description;
    Instant createdAt;
}
