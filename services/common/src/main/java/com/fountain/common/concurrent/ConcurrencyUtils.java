package com.fountain.common.concurrent;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Thread-safe utilities for lock-guarded sections
 */
@Slf4j
public final class ConcurrencyUtils {

    private ConcurrencyUtils() {
    }

    /**
     * Executes an action once the lock is acquired within {@code timeout}.
     *
     * @throws LockTimeoutException if the lock is not acquired in time or the
     *         waiting thread is interrupted
     */
    public static <T> T withLock(Lock lock, String lockName, Duration timeout, Supplier<T> action) {
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Lock acquisition interrupted: {}", lockName);
            throw new LockTimeoutException("Interrupted while waiting for lock '" + lockName + "'", e);
        }
        if (!acquired) {
            log.warn("Lock acquisition timed out: lock={}, timeout={}", lockName, timeout);
            throw new LockTimeoutException(lockName, timeout);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
