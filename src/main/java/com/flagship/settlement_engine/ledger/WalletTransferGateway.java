package com.flagship.settlement_engine.ledger;

import com.flagship.settlement_engine.exception.SettlementException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Transfers into the recipient's available balance, then runs the recipient's receive hook.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WalletTransferGateway implements TransferGateway {

    private final LedgerJournal journal;
    private final ReceiveHookRegistry hooks;

    @Override
    public void transfer(String recipient, BigDecimal amount, String description) {
        journal.addAvailable(recipient, amount);
        journal.record(recipient, Bucket.AVAILABLE, EntryType.CREDIT, amount, description);

        ReceiveHook hook = hooks.find(recipient).orElse(null);
        if (hook == null) {
            return;
        }

        log.debug("Running receive hook: recipient={}, amount={}", recipient, amount);
        try {
            hook.onReceive(recipient, amount);
        } catch (RuntimeException e) {
            log.warn("Receive hook refused transfer: recipient={}, amount={}, error={}",
                recipient, amount, e.getMessage());
            throw SettlementException.transferFailed(recipient, amount, e);
        }
    }
}
