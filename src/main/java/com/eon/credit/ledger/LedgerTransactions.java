package com.eon.credit.ledger;

import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes state transitions. Each write holds one process-wide fair lock and runs in one
 * database transaction, so a rejected step rolls back every row the transition touched.
 * Re-entrant: nested calls join the outer transaction.
 */
@Component
public class LedgerTransactions {

    private final ReentrantLock writeLock = new ReentrantLock(true);
    private final TransactionTemplate tx;

    public LedgerTransactions(PlatformTransactionManager transactionManager) {
        this.tx = new TransactionTemplate(transactionManager);
    }

    public <T> T write(Supplier<T> work) {
        writeLock.lock();
        try {
            return tx.execute(status -> work.get());
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
}
