package com.flagship.settlement_engine.host;

import com.flagship.settlement_engine.exception.FailureKind;
import com.flagship.settlement_engine.exception.SettlementException;
import com.flagship.settlement_engine.guard.ReentrancyGuard;
import com.flagship.settlement_engine.observability.CorrelationContext;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs one engine operation as one call: reentrancy guard, then a database transaction,
 * then the body.
 *
 * The guard is taken outside the transaction. A call rejected as reentrant therefore never
 * joins, and never poisons, the transaction of the call it tried to re-enter. A nested call
 * into a different engine joins the running transaction; if it fails, the outer call fails
 * too with {@code TransferFailed}.
 */
@Component
@Slf4j
public class EngineCallExecutor {

    private final TransactionTemplate transactionTemplate;
    private final SettlementMetrics metrics;

    public EngineCallExecutor(PlatformTransactionManager transactionManager, SettlementMetrics metrics) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        this.metrics = metrics;
    }

    public <T> T execute(ReentrancyGuard guard, String operation, Supplier<T> body) {
        String engine = guard.getEngine();
        String outerEngine = MDC.get(CorrelationContext.ENGINE_MDC_KEY);
        String outerOperation = MDC.get(CorrelationContext.OPERATION_MDC_KEY);
        MDC.put(CorrelationContext.ENGINE_MDC_KEY, engine);
        MDC.put(CorrelationContext.OPERATION_MDC_KEY, operation);

        long startTime = System.nanoTime();

        try (ReentrancyGuard.Permit ignored = guard.enter(operation)) {
            T result = transactionTemplate.execute(status -> {
                T value = body.get();
                if (status.isNewTransaction() && status.isRollbackOnly()) {
                    throw SettlementException.of(FailureKind.TRANSFER_FAILED,
                        "engine", engine, "operation", operation, "reason", "nested call failed");
                }
                return value;
            });

            metrics.recordCall(engine, operation, "success", elapsedSince(startTime));
            log.debug("{}.{} committed", engine, operation);
            return result;

        } catch (SettlementException e) {
            if (e.is(FailureKind.REENTRANCY_DETECTED)) {
                metrics.recordReentrancyRejected(engine, operation);
            }
            metrics.recordCall(engine, operation, e.getKind().getErrorName(), elapsedSince(startTime));
            log.info("{}.{} rejected: {}", engine, operation, e.getMessage());
            throw e;
        } catch (IllegalArgumentException e) {
            metrics.recordCall(engine, operation, "invalid_request", elapsedSince(startTime));
            log.info("{}.{} rejected: {}", engine, operation, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordCall(engine, operation, "error", elapsedSince(startTime));
            log.error("{}.{} failed: error={}", engine, operation, e.getMessage());
            throw e;
        } finally {
            restore(CorrelationContext.ENGINE_MDC_KEY, outerEngine);
            restore(CorrelationContext.OPERATION_MDC_KEY, outerOperation);
        }
    }

    public void run(ReentrancyGuard guard, String operation, Runnable body) {
        execute(guard, operation, () -> {
            body.run();
            return null;
        });
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static void restore(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
