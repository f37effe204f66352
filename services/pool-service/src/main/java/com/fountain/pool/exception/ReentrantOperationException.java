package com.fountain.pool.exception;

import com.fountain.common.exception.ErrorCode;

/**
 * Exception thrown when a ledger operation is started from inside another one,
 * typically from an asset transfer callback
 */
public class ReentrantOperationException extends FountainException {

    public ReentrantOperationException(String operation) {
        super(ErrorCode.POOL_REENTRANT_CALL, "Rejected re-entrant call to " + operation);
        withMetadata("operation", operation);
    }
}
