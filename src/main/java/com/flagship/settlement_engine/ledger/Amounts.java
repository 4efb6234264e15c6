package com.flagship.settlement_engine.ledger;

import com.flagship.settlement_engine.exception.FailureKind;
import com.flagship.settlement_engine.exception.SettlementException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Arithmetic on value amounts. Amounts are whole units; fractional results round down.
 */
public final class Amounts {

    public static final int BPS_DENOMINATOR = 10_000;

    private Amounts() {
        // Utility class
    }

    /**
     * Returns the amount unchanged if it is a positive whole number of units, otherwise
     * fails with {@code InvalidAmount}.
     */
    public static BigDecimal requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0 || !isWhole(amount)) {
            throw SettlementException.of(FailureKind.INVALID_AMOUNT, "amount", amount);
        }
        return normalize(amount);
    }

    /**
     * {@code amount * bps / 10000}, rounded down.
     */
    public static BigDecimal bps(BigDecimal amount, int bps) {
        return amount.multiply(BigDecimal.valueOf(bps))
            .divide(BigDecimal.valueOf(BPS_DENOMINATOR), 0, RoundingMode.DOWN);
    }

    public static boolean isWhole(BigDecimal amount) {
        return amount.signum() == 0 || amount.stripTrailingZeros().scale() <= 0;
    }

    public static BigDecimal normalize(BigDecimal amount) {
        return amount.setScale(0, RoundingMode.UNNECESSARY);
    }
}
