package com.fountain.common.concurrent;

import com.fountain.common.exception.BusinessException;
import com.fountain.common.exception.ErrorCode;

import java.time.Duration;

/**
 * Exception thrown when lock acquisition times out.
 */
public class LockTimeoutException extends BusinessException {

    private final String lockName;
    private final Duration waitTime;

    public LockTimeoutException(String lockName, Duration waitTime) {
        super(ErrorCode.SYS_LOCK_TIMEOUT,
                String.format("Failed to acquire lock '%s' within %d ms", lockName, waitTime.toMillis()));
        this.lockName = lockName;
        this.waitTime = waitTime;
    }

    public LockTimeoutException(String message, Throwable cause) {
        super(ErrorCode.SYS_LOCK_TIMEOUT, message, cause);
        this.lockName = null;
        this.waitTime = Duration.ZERO;
    }

    public String getLockName() {
        return lockName;
    }

    public Duration getWaitTime() {
        return waitTime;
    }
}
