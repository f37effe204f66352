package com.fountain.common.exception;

/**
 * Error codes for the Fountain platform
 * Format: MODULE_SPECIFIC_ERROR
 */
public enum ErrorCode {

    // ===== MONEY POOL ERRORS (POOL_XXX) =====
    POOL_NOT_FOUND("POOL_001", "Money pool not found"),
    POOL_INVALID_AMOUNT("POOL_002", "Amount must be a positive whole number of asset units"),
    POOL_INVALID_CONFIGURATION("POOL_003", "Invalid money pool configuration"),
    POOL_UNAUTHORIZED("POOL_004", "Caller is not allowed to perform this operation"),
    POOL_INSUFFICIENT_FUNDS("POOL_005", "Requested amount exceeds the tappable amount"),
    POOL_IMMUTABLE("POOL_006", "Money pool has been funded and can no longer be reconfigured"),
    POOL_TRANSFER_FAILED("POOL_007", "Asset transfer failed"),
    POOL_NOTHING_TO_CLAIM("POOL_008", "No redistribution available to claim"),
    POOL_REENTRANT_CALL("POOL_009", "Operation attempted while another operation is in flight"),

    // ===== SYSTEM ERRORS (SYS_XXX) =====
    SYS_INTERNAL_ERROR("SYS_001", "Internal system error"),
    SYS_LOCK_TIMEOUT("SYS_002", "Timed out waiting for a lock");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    /**
     * Find error code by code string
     */
    public static ErrorCode fromCode(String code) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.code.equals(code)) {
                return errorCode;
            }
        }
        return SYS_INTERNAL_ERROR;
    }
}
