package com.fountain.pool.exception;

import com.fountain.common.exception.ErrorCode;

/**
 * Exception thrown when a target, duration or asset cannot configure a money pool
 */
public class InvalidConfigurationException extends FountainException {

    public InvalidConfigurationException(String message) {
        super(ErrorCode.POOL_INVALID_CONFIGURATION, message);
    }
}
