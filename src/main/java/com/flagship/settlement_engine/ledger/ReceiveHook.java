package com.flagship.settlement_engine.ledger;

import java.math.BigDecimal;

/**
 * Code that runs when value is transferred to an account, after the value has arrived.
 *
 * A hook may call back into the engines. Throwing refuses the transfer, which fails the
 * whole call with {@code TransferFailed}.
 */
@FunctionalInterface
public interface ReceiveHook {

    void onReceive(String recipient, BigDecimal amount);
}
