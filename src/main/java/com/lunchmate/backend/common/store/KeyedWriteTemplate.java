package com.lunchmate.backend.common.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs a read-then-write against a row identified by a logical unique key, each attempt in its own transaction.
 * Losing an insert race (unique or primary key violation), an optimistic-lock race or a deadlock rolls the attempt back
 * and runs the whole callback again, so the next attempt re-reads what the winner wrote.
 * Domain exceptions are never retried.
 */
@Slf4j
public class KeyedWriteTemplate {

    private final TransactionTemplate tx;
    private final int maxAttempts;

    public KeyedWriteTemplate(PlatformTransactionManager transactionManager, int retries) {
        this.tx = new TransactionTemplate(transactionManager);
        this.maxAttempts = 1 + Math.max(0, retries);
    }

    public <T> T execute(String operation, TransactionCallback<T> action) {
        for (int attempt = 1; ; attempt++) {
            try {
                return tx.execute(action);
            } catch (DataIntegrityViolationException | ConcurrencyFailureException ex) {
                if (attempt >= maxAttempts) {
                    log.warn("{} still conflicting after {} attempts", operation, attempt);
                    throw ex;
                }
                log.info("{} lost a write race, re-reading (attempt {}/{}): {}",
                        operation, attempt, maxAttempts, ex.getClass().getSimpleName());
            }
        }
    }
}
