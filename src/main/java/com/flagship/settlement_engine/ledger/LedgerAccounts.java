package com.flagship.settlement_engine.ledger;

import java.math.BigDecimal;
import java.util.List;

/**
 * The shared ledger as the engines see it.
 *
 * Mutations must run inside the engine call's transaction; a failed call discards them.
 * The sum of all pending balances never exceeds the custody balance.
 */
public interface LedgerAccounts {

    /**
     * Host funding: value arriving from outside the engine.
     */
    void deposit(String accountId, BigDecimal amount, String description);

    /**
     * Takes value attached to a call from the payer's available balance into custody.
     * Fails with {@code InsufficientFunds} if the payer cannot cover it.
     */
    void collect(String payer, BigDecimal amount, String description);

    /**
     * Adds to the account's pending balance. The value must already be in custody.
     */
    void credit(String accountId, BigDecimal amount, String description);

    /**
     * Zeroes the pending balance, then transfers the full amount out of custody.
     * Fails with {@code NoPendingWithdrawals} when nothing is pending.
     *
     * @return the amount transferred
     */
    BigDecimal withdraw(String accountId);

    /**
     * Direct transfer out of custody. Only used to return excess payment.
     */
    void pay(String accountId, BigDecimal amount, String description);

    AccountBalance getBalance(String accountId);

    BigDecimal getPendingWithdrawal(String accountId);

    List<LedgerEntry> getEntries(String accountId);

    BigDecimal getCustodyBalance();

    BigDecimal getTotalPending();
}
