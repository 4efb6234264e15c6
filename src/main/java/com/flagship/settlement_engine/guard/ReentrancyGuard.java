package com.flagship.settlement_engine.guard;

import com.flagship.settlement_engine.exception.FailureKind;
import com.flagship.settlement_engine.exception.SettlementException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-call lock scoped to one engine instance.
 *
 * Every externally callable mutating operation enters the guard before doing anything else
 * and leaves it on every exit path:
 *
 * <pre>{@code
 * try (ReentrancyGuard.Permit ignored = guard.enter("release")) {
 *     ...
 * }
 * }</pre>
 *
 * A second entry while a permit is outstanding fails with {@code ReentrancyDetected}. This
 * is what stops a recipient whose receive path calls back into the engine while a transfer
 * is still in flight.
 */
@Slf4j
public class ReentrancyGuard {

    private final String engine;
    private final AtomicBoolean entered = new AtomicBoolean(false);
    private volatile String heldBy;

    public ReentrancyGuard(String engine) {
        this.engine = engine;
    }

    public Permit enter(String operation) {
        if (!entered.compareAndSet(false, true)) {
            log.warn("Reentrant call rejected: engine={}, operation={}, heldBy={}", engine, operation, heldBy);
            throw SettlementException.of(FailureKind.REENTRANCY_DETECTED,
                "engine", engine, "operation", operation);
        }
        heldBy = operation;
        return new Permit();
    }

    public boolean isEntered() {
        return entered.get();
    }

    public String getEngine() {
        return engine;
    }

    /**
     * Outstanding entry; closing it releases the guard exactly once.
     */
    public final class Permit implements AutoCloseable {

        private boolean released;

        private Permit() {
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                heldBy = null;
                entered.set(false);
            }
        }
    }
}
