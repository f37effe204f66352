package com.fountain.pool.exception;

import com.fountain.common.exception.ErrorCode;

import java.math.BigDecimal;

/**
 * Exception thrown when an amount is not a positive whole number of asset units
 */
public class InvalidAmountException extends FountainException {

    private final BigDecimal amount;

    public InvalidAmountException(BigDecimal amount) {
        super(ErrorCode.POOL_INVALID_AMOUNT, "Invalid amount: " + amount);
        this.amount = amount;
        withMetadata("amount", amount);
    }

    public BigDecimal getAmount() {
        return amount;
    }
}
