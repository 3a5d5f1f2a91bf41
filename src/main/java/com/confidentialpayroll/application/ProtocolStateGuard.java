package com.confidentialpayroll.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes every state transition of the protocol.
 *
 * <p>One fair lock covers the record store, the batch registry, the decryption context table
 * and the cooldown table. The lock is taken before the transaction begins and released after
 * it commits or rolls back, so no two entry points ever observe each other's uncommitted
 * writes. Any exception thrown by the action rolls the transaction back.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Component
@Slf4j
public class ProtocolStateGuard {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final TransactionOperations transactions;

    public ProtocolStateGuard(TransactionOperations transactions) {
        this.transactions = transactions;
    }

    /**
     * Apply one state transition atomically.
     *
     * @param operation Name used in logs
     * @param action Checks followed by writes
     * @return Result of the action
     */
    public <T> T execute(String operation, Supplier<T> action) {
        lock.lock();
        try {
            if (log.isTraceEnabled()) {
                log.trace("Entering {} (queued={})", operation, lock.getQueueLength());
            }
            return transactions.execute(status -> action.get());
        } finally {
            lock.unlock();
        }
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }
}
