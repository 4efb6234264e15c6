package com.flagship.settlement_engine.ledger;

import com.flagship.settlement_engine.guard.AccessGuard;
import com.flagship.settlement_engine.guard.ReentrancyGuard;
import com.flagship.settlement_engine.host.EngineCallExecutor;
import com.flagship.settlement_engine.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Host-facing ledger operations: funding accounts and reading balances.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final ReentrancyGuard guard = new ReentrancyGuard("ledger");

    private final LedgerAccounts ledger;
    private final EngineCallExecutor executor;
    private final OutboxService outboxService;

    /**
     * Funds an account's available balance from outside the engine.
     */
    public AccountBalance deposit(String accountId, BigDecimal amount) {
        return executor.execute(guard, "deposit", () -> {
            AccessGuard.requireAccount(accountId, "account");
            BigDecimal value = Amounts.requirePositive(amount);

            ledger.deposit(accountId, value, "Deposit");
            outboxService.saveEvent(new LedgerEvents.Deposited(accountId, value));

            log.info("Account funded: account={}, amount={}", accountId, value);
            return ledger.getBalance(accountId);
        });
    }

    public AccountBalance getBalance(String accountId) {
        return ledger.getBalance(accountId);
    }

    public List<LedgerEntry> getEntries(String accountId) {
        return ledger.getEntries(accountId);
    }

    public BigDecimal getCustodyBalance() {
        return ledger.getCustodyBalance();
    }

    public BigDecimal getTotalPending() {
        return ledger.getTotalPending();
    }
}
