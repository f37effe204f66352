package com.fountain.pool.exception;

import com.fountain.common.exception.ErrorCode;

import java.math.BigDecimal;

/**
 * Exception thrown when the asset transfer collaborator cannot move funds
 */
public class TransferFailedException extends FountainException {

    public TransferFailedException(String asset, String account, BigDecimal amount, String reason) {
        super(ErrorCode.POOL_TRANSFER_FAILED,
                String.format("Transfer of %s %s for %s failed: %s", amount, asset, account, reason));
        describe(asset, account, amount);
    }

    public TransferFailedException(String asset, String account, BigDecimal amount, Throwable cause) {
        super(ErrorCode.POOL_TRANSFER_FAILED,
                String.format("Transfer of %s %s for %s failed: %s", amount, asset, account, cause.getMessage()), cause);
        describe(asset, account, amount);
    }

    private void describe(String asset, String account, BigDecimal amount) {
        withMetadata("asset", asset);
        withMetadata("account", account);
        withMetadata("amount", amount);
    }
}
