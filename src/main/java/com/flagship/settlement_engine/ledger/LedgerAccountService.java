package com.flagship.settlement_engine.ledger;

import com.flagship.settlement_engine.exception.FailureKind;
import com.flagship.settlement_engine.exception.SettlementException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * JDBC-backed ledger shared by the escrow, voting and marketplace engines.
 *
 * Every movement is journaled: one entry per bucket touched. Withdrawals clear the pending
 * balance before any value leaves, so a recipient that calls back in finds nothing left
 * to withdraw.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerAccountService implements LedgerAccounts {

    private final LedgerJournal journal;
    private final TransferGateway transferGateway;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void deposit(String accountId, BigDecimal amount, String description) {
        BigDecimal value = Amounts.requirePositive(amount);
        journal.addAvailable(accountId, value);
        journal.record(accountId, Bucket.AVAILABLE, EntryType.CREDIT, value, description);
        log.debug("Deposited {} to {}", value, accountId);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void collect(String payer, BigDecimal amount, String description) {
        BigDecimal value = Amounts.requirePositive(amount);
        if (!journal.subtractAvailable(payer, value)) {
            BigDecimal available = getBalance(payer).getAvailable();
            throw SettlementException.of(FailureKind.INSUFFICIENT_FUNDS,
                "account", payer, "required", value, "available", available);
        }
        journal.record(payer, Bucket.AVAILABLE, EntryType.DEBIT, value, description);
        journal.addCustody(value);
        journal.recordCustody(EntryType.CREDIT, value, description);
        log.debug("Collected {} from {} into custody", value, payer);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void credit(String accountId, BigDecimal amount, String description) {
        BigDecimal value = Amounts.requirePositive(amount);
        journal.addPending(accountId, value);
        journal.record(accountId, Bucket.PENDING, EntryType.CREDIT, value, description);
        log.debug("Credited {} to pending balance of {}", value, accountId);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public BigDecimal withdraw(String accountId) {
        BigDecimal amount = journal.clearPending(accountId);
        if (amount.signum() <= 0) {
            throw SettlementException.of(FailureKind.NO_FUNDS, "account", accountId);
        }
        String description = "Withdrawal";
        journal.record(accountId, Bucket.PENDING, EntryType.DEBIT, amount, description);
        journal.subtractCustody(amount);
        journal.recordCustody(EntryType.DEBIT, amount, description);

        transferGateway.transfer(accountId, amount, description);

        log.info("Withdrawal settled: account={}, amount={}", accountId, amount);
        return amount;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void pay(String accountId, BigDecimal amount, String description) {
        BigDecimal value = Amounts.requirePositive(amount);
        journal.subtractCustody(value);
        journal.recordCustody(EntryType.DEBIT, value, description);
        transferGateway.transfer(accountId, value, description);
        log.debug("Paid {} to {}", value, accountId);
    }

    @Override
    public AccountBalance getBalance(String accountId) {
        return journal.findBalance(accountId).orElseGet(() -> AccountBalance.empty(accountId));
    }

    @Override
    public BigDecimal getPendingWithdrawal(String accountId) {
        return getBalance(accountId).getPendingWithdrawal();
    }

    @Override
    public List<LedgerEntry> getEntries(String accountId) {
        return journal.findEntries(accountId);
    }

    @Override
    public BigDecimal getCustodyBalance() {
        return journal.getCustodyBalance();
    }

    @Override
    public BigDecimal getTotalPending() {
        return journal.getTotalPending();
    }
}
