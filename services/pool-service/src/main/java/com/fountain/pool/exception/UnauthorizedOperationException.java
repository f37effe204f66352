package com.fountain.pool.exception;

import com.fountain.common.exception.ErrorCode;

/**
 * Exception thrown when the caller may not perform the requested operation
 */
public class UnauthorizedOperationException extends FountainException {

    public UnauthorizedOperationException(String message) {
        super(ErrorCode.POOL_UNAUTHORIZED, message);
    }
}
