package com.fountain.pool.exception;

import com.fountain.common.exception.BusinessException;
import com.fountain.common.exception.ErrorCode;

/**
 * Base exception for the pool service
 */
public class FountainException extends BusinessException {

    public FountainException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public FountainException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
