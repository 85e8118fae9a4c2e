package com.infomedia.abacox.callbilling.component.settlement;

import com.infomedia.abacox.callbilling.config.CallBillingProperties;
import com.infomedia.abacox.callbilling.exception.LedgerWriteException;
import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.OptimisticLockException;
import jakarta.persistence.PessimisticLockException;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Runs a ledger write in its own transaction and replays the whole block when it loses a
 * race on an account row. A block either commits completely or leaves no trace, so a balance
 * change is never stored without its transaction record.
 * <p>
 * Business exceptions thrown by the block roll it back and propagate on the first attempt.
 */
@Component
@Log4j2
public class LedgerWriteExecutor {

    private final TransactionTemplate txTemplate;
    private final int maxAttempts;
    private final Duration backoff;

    public LedgerWriteExecutor(PlatformTransactionManager transactionManager, CallBillingProperties properties) {
        // Configure a template for REQUIRES_NEW behavior so a retry never reuses a doomed transaction
        this.txTemplate = new TransactionTemplate(transactionManager);
        this.txTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.maxAttempts = Math.max(1, properties.getLedger().getMaxWriteAttempts());
        this.backoff = properties.getLedger().getRetryBackoff();
    }

    public <T> T execute(String operation, TransactionCallback<T> work) {
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return txTemplate.execute(work);
            } catch (RuntimeException e) {
                if (!isRetryable(e)) {
                    throw e;
                }
                lastFailure = e;
                log.debug("Ledger write '{}' conflicted (attempt {}/{}): {}", operation, attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts) {
                    pause(operation, attempt, e);
                }
            }
        }
        log.error("Ledger write '{}' gave up after {} attempts", operation, maxAttempts, lastFailure);
        throw new LedgerWriteException(operation, maxAttempts, lastFailure);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    static boolean isRetryable(Throwable e) {
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof TransientDataAccessException
                    || cause instanceof OptimisticLockException
                    || cause instanceof PessimisticLockException
                    || cause instanceof LockTimeoutException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private void pause(String operation, int attempt, RuntimeException failure) {
        long base = backoff.toMillis() * attempt;
        long delay = Math.max(1, Math.round(base * (0.5 + ThreadLocalRandom.current().nextDouble())));
        try {
            Thread.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new LedgerWriteException(operation, attempt, failure);
        }
    }
}
