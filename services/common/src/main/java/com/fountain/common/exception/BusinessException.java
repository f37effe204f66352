package com.fountain.common.exception;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Base exception for all business rule violations.
 *
 * Carries a type-safe {@link ErrorCode}, a unique error id for correlating log
 * lines, and metadata that callers may enrich before rethrowing.
 *
 * USAGE:
 * <pre>
 * throw new BusinessException(ErrorCode.POOL_NOT_FOUND, "No pool for owner " + owner)
 *     .withMetadata("owner", owner);
 * </pre>
 */
public class BusinessException extends RuntimeException {

    private final String errorId;
    private final ErrorCode errorCode;
    private final Map<String, Object> metadata;
    private final Instant timestamp;

    public BusinessException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, null);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> metadata) {
        this(errorCode, message, null, metadata);
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause, Map<String, Object> metadata) {
        super(buildMessage(errorCode, message), cause);
        this.errorId = UUID.randomUUID().toString();
        this.errorCode = errorCode != null ? errorCode : ErrorCode.SYS_INTERNAL_ERROR;
        this.metadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
        this.timestamp = Instant.now();
    }

    // ===== FLUENT API FOR METADATA ENRICHMENT =====

    /**
     * Add single metadata entry (fluent API). Null keys and values are ignored.
     */
    public BusinessException withMetadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, value);
        }
        return this;
    }

    public BusinessException withMetadata(Map<String, Object> additionalMetadata) {
        if (additionalMetadata != null) {
            this.metadata.putAll(additionalMetadata);
        }
        return this;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getCode() {
        return errorCode.getCode();
    }

    public String getErrorId() {
        return errorId;
    }

    /**
     * Get metadata map (unmodifiable view). Use withMetadata() to add entries.
     */
    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Get metadata value by key with type casting
     */
    @SuppressWarnings("unchecked")
    public <T> T getMetadataValue(String key, Class<T> type) {
        Object value = metadata.get(key);
        if (value == null) {
            return null;
        }
        if (type.isInstance(value)) {
            return (T) value;
        }
        throw new ClassCastException(
            String.format("Metadata value for key '%s' is not of type %s", key, type.getName())
        );
    }

    private static String buildMessage(ErrorCode errorCode, String message) {
        if (errorCode == null) {
            return message != null ? message : "Business error occurred";
        }
        return String.format("[%s] %s", errorCode.getCode(),
            message != null ? message : errorCode.getDefaultMessage());
    }

    @Override
    public String toString() {
        return String.format("BusinessException[errorId=%s, errorCode=%s, message=%s, metadata=%s, timestamp=%s]",
            errorId, errorCode.getCode(), getMessage(), metadata, timestamp);
    }
}
