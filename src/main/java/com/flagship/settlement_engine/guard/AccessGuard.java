package com.flagship.settlement_engine.guard;

import com.flagship.settlement_engine.exception.FailureKind;
import com.flagship.settlement_engine.exception.SettlementException;

import java.util.Collection;

/**
 * Authorization predicates shared by the engines.
 * Callers are opaque, pre-authenticated principals; identity is plain string equality.
 */
public final class AccessGuard {

    private AccessGuard() {
        // Utility class
    }

    /**
     * Fails with {@code Unauthorized(caller, requiredRole)} unless the caller is the expected principal.
     */
    public static void requireCaller(String caller, String expected, String requiredRole) {
        if (caller == null || !caller.equals(expected)) {
            throw SettlementException.unauthorized(caller, requiredRole);
        }
    }

    /**
     * Fails with {@code Unauthorized} unless the caller is one of the allowed principals.
     */
    public static void requireOneOf(String caller, Collection<String> allowed, String requiredRole) {
        if (caller == null || !allowed.contains(caller)) {
            throw SettlementException.unauthorized(caller, requiredRole);
        }
    }

    /**
     * Same check as {@link #requireCaller} but reported with a dedicated failure kind
     * ({@code NotChairperson}, {@code NotContractOwner}, ...).
     */
    public static void requireRole(String caller, String expected, FailureKind kind) {
        if (caller == null || !caller.equals(expected)) {
            throw SettlementException.of(kind, "caller", caller);
        }
    }

    /**
     * Fails with {@code ZeroAddress} for a missing or blank account id.
     */
    public static String requireAccount(String account, String field) {
        if (account == null || account.isBlank()) {
            throw SettlementException.of(FailureKind.ZERO_ADDRESS, "field", field);
        }
        return account;
    }
}
