package com.flagship.settlement_engine.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Typed failure of an engine call.
 *
 * Thrown from inside the call's transaction, so throwing it discards every mutation the
 * call made (ledger, records and notifications alike).
 */
@Getter
public class SettlementException extends RuntimeException {

    private final FailureKind kind;
    private final Map<String, Object> arguments;

    private SettlementException(FailureKind kind, Map<String, Object> arguments, Throwable cause) {
        super(describe(kind, arguments), cause);
        this.kind = kind;
        this.arguments = Collections.unmodifiableMap(arguments);
    }

    /**
     * Creates a failure from alternating argument names and values.
     */
    public static SettlementException of(FailureKind kind, Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Arguments must be name/value pairs");
        }
        Map<String, Object> arguments = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            arguments.put(String.valueOf(namesAndValues[i]), namesAndValues[i + 1]);
        }
        return new SettlementException(kind, arguments, null);
    }

    public static SettlementException unauthorized(String caller, String requiredRole) {
        return of(FailureKind.UNAUTHORIZED, "caller", caller, "requiredRole", requiredRole);
    }

    public static SettlementException invalidState(Object current, Object expected) {
        return of(FailureKind.INVALID_STATE, "current", current, "expected", expected);
    }

    public static SettlementException transferFailed(String recipient, Object amount, Throwable cause) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("recipient", recipient);
        arguments.put("amount", amount);
        return new SettlementException(FailureKind.TRANSFER_FAILED, arguments, cause);
    }

    public boolean is(FailureKind candidate) {
        return kind == candidate;
    }

    private static String describe(FailureKind kind, Map<String, Object> arguments) {
        if (arguments.isEmpty()) {
            return kind.getErrorName();
        }
        return arguments.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining(", ", kind.getErrorName() + "(", ")"));
    }
}
