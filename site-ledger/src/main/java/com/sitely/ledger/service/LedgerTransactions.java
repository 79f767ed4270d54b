package com.sitely.ledger.service;

import com.sitely.ledger.exception.LedgerConstraintException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single-writer gate for the embedded store. Every mutating call goes through
 * {@link #write(Supplier)}: one lock holder at a time, one transaction per
 * call, so two quick calls from the caller never interleave.
 *
 * Reads do not take the lock.
 */
@Component
public class LedgerTransactions {

    private final ReentrantLock writeLock = new ReentrantLock(true);
    private final TransactionTemplate transactionTemplate;

    public LedgerTransactions(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public <T> T write(Supplier<T> work) {
        writeLock.lock();
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataIntegrityViolationException e) {
            throw new LedgerConstraintException(constraintMessage(e), e);
        } finally {
            writeLock.unlock();
        }
    }

    public void run(Runnable work) {
        write(() -> {
            work.run();
            return null;
        });
    }

    private static String constraintMessage(DataIntegrityViolationException e) {
        Throwable root = e.getMostSpecificCause();
        return "Constraint violated: " + (root.getMessage() == null ? e.getMessage() : root.getMessage());
    }
}
