package com.fountain.pool.exception;

import com.fountain.common.exception.ErrorCode;

/**
 * Exception thrown when a funded money pool is reconfigured in place
 */
public class ImmutableMoneyPoolException extends FountainException {

    public ImmutableMoneyPoolException(long poolNumber) {
        super(ErrorCode.POOL_IMMUTABLE, "Money pool " + poolNumber + " has been funded and can no longer be reconfigured");
        withMetadata("poolNumber", poolNumber);
    }
}
