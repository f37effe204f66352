package com.fountain.pool.exception;

import com.fountain.common.exception.ErrorCode;

/**
 * Exception thrown when no money pool can be resolved
 */
public class MoneyPoolNotFoundException extends FountainException {

    private MoneyPoolNotFoundException(String message) {
        super(ErrorCode.POOL_NOT_FOUND, message);
    }

    public static MoneyPoolNotFoundException forOwner(String owner) {
        MoneyPoolNotFoundException e = new MoneyPoolNotFoundException("No money pool configured by owner " + owner);
        e.withMetadata("owner", owner);
        return e;
    }

    public static MoneyPoolNotFoundException forNumber(long number) {
        MoneyPoolNotFoundException e = new MoneyPoolNotFoundException("Money pool not found: " + number);
        e.withMetadata("poolNumber", number);
        return e;
    }
}
