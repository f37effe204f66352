package com.fountain.pool.exception;

import com.fountain.common.exception.ErrorCode;

import java.math.BigDecimal;

/**
 * Exception thrown when an owner taps more than the pool holds for them
 */
public class InsufficientFundsException extends FountainException {

    private final long poolNumber;
    private final BigDecimal requestedAmount;
    private final BigDecimal availableAmount;

    public InsufficientFundsException(long poolNumber, BigDecimal requestedAmount, BigDecimal availableAmount) {
        super(ErrorCode.POOL_INSUFFICIENT_FUNDS, String.format(
                "Insufficient funds in money pool %d. Requested: %s, Available: %s",
                poolNumber, requestedAmount, availableAmount));
        this.poolNumber = poolNumber;
        this.requestedAmount = requestedAmount;
        this.availableAmount = availableAmount;
    }

    public long getPoolNumber() {
        return poolNumber;
    }

    public BigDecimal getRequestedAmount() {
        return requestedAmount;
    }

    public BigDecimal getAvailableAmount() {
        return availableAmount;
    }
}
