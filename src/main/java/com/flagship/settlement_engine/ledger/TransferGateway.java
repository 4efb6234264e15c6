package com.flagship.settlement_engine.ledger;

import java.math.BigDecimal;

/**
 * Moves value that has already left custody to its recipient.
 */
public interface TransferGateway {

    /**
     * @throws com.flagship.settlement_engine.exception.SettlementException
     *         {@code TransferFailed} if the recipient refuses the transfer
     */
    void transfer(String recipient, BigDecimal amount, String description);
}
