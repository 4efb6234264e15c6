package com.flagship.settlement_engine.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Balance record of one account. Accounts never seen by the ledger read as zero.
 */
@Value
public class AccountBalance {
    String accountId;
    BigDecimal available;
    BigDecimal pendingWithdrawal;

    public static AccountBalance empty(String accountId) {
        return new AccountBalance(accountId, BigDecimal.ZERO, BigDecimal.ZERO);
    }
}
