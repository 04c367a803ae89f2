package com.flagship.value_ledger.ledger;

import com.flagship.value_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs a unit of ledger work in its own database transaction.
 *
 * Outcomes:
 * 1. The work returns normally: the transaction commits and the value is returned as success.
 * 2. The work raises {@link LedgerRejection}: the transaction rolls back and the
 *    rejection becomes a failed {@link LedgerResult}.
 * 3. The database reports a transient conflict (deadlock, lock timeout, serialization
 *    failure): the whole transaction is re-run, up to {@code ledger.retry.max-attempts}.
 * 4. Any other storage failure, or conflicts beyond the retry budget, surface as
 *    {@link StorageFaultException}.
 *
 * Must not be called with a transaction already open: a retry has to start from scratch.
 */
@Component
@Slf4j
public class LedgerTransactionExecutor {

    private final TransactionTemplate transactionTemplate;
    private final LedgerMetrics metrics;
    private final int maxAttempts;
    private final long backoffMs;

    public LedgerTransactionExecutor(PlatformTransactionManager transactionManager,
                                     LedgerMetrics metrics,
                                     @Value("${ledger.retry.max-attempts:3}") int maxAttempts,
                                     @Value("${ledger.retry.backoff-ms:25}") long backoffMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("ledger.retry.max-attempts must be at least 1");
        }
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.metrics = metrics;
        this.maxAttempts = maxAttempts;
        this.backoffMs = backoffMs;
    }

    public <T> LedgerResult<T> execute(String operation, Supplier<T> work) {
        long startTime = System.nanoTime();
        int attempt = 1;
        while (true) {
            try {
                T value = transactionTemplate.execute(status -> work.get());
                metrics.recordOperationDuration(operation, "success", Duration.ofNanos(System.nanoTime() - startTime));
                return LedgerResult.success(value);

            } catch (LedgerRejection rejection) {
                metrics.recordRejection(operation, rejection.getError());
                metrics.recordOperationDuration(operation, "rejected", Duration.ofNanos(System.nanoTime() - startTime));
                log.info("Ledger operation rejected: operation={}, error={}, reason={}",
                        operation, rejection.getError(), rejection.getMessage());
                return LedgerResult.failure(rejection.getError(), rejection.getMessage());

            } catch (TransientDataAccessException conflict) {
                if (attempt >= maxAttempts) {
                    metrics.recordStorageFault(operation);
                    log.error("Ledger operation still conflicting after {} attempts: operation={}",
                            attempt, operation, conflict);
                    throw new StorageFaultException(
                        "Storage conflict persisted after " + attempt + " attempts: " + operation, conflict);
                }
                metrics.recordRetry(operation);
                log.warn("Storage conflict, retrying: operation={}, attempt={}/{}, error={}",
                        operation, attempt, maxAttempts, conflict.getMessage());
                pause(attempt, operation, conflict);
                attempt++;

            } catch (DataAccessException | TransactionException e) {
                metrics.recordStorageFault(operation);
                log.error("Storage failure: operation={}", operation, e);
                throw new StorageFaultException("Storage failure during " + operation, e);
            }
        }
    }

    private void pause(int attempt, String operation, RuntimeException cause) {
        if (backoffMs <= 0) {
            return;
        }
        try {
            Thread.sleep(backoffMs * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageFaultException("Interrupted while retrying " + operation, cause);
        }
    }
}
