package com.flagship.settlement_engine.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Receive hooks by account id. Accounts without a hook accept every transfer.
 */
@Component
@Slf4j
public class ReceiveHookRegistry {

    private final Map<String, ReceiveHook> hooks = new ConcurrentHashMap<>();

    public void register(String accountId, ReceiveHook hook) {
        hooks.put(accountId, hook);
        log.info("Registered receive hook for account {}", accountId);
    }

    public void unregister(String accountId) {
        if (hooks.remove(accountId) != null) {
            log.info("Removed receive hook for account {}", accountId);
        }
    }

    public Optional<ReceiveHook> find(String accountId) {
        return Optional.ofNullable(hooks.get(accountId));
    }
}
