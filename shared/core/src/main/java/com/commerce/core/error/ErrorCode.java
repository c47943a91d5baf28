package com.commerce.core.error;

/**
 * Error taxonomy shared by the ledger, reservation and saga modules.
 * <p>
 * Only gateway, network and timeout failures are retryable. {@link #UNKNOWN} is
 * deliberately non-retryable so programming errors are not retried as if transient.
 */
public enum ErrorCode {

    VALIDATION_FAILED("COMMON_001", "Invalid input", false),
    NOT_FOUND("COMMON_002", "Resource not found", false),
    INVALID_STATE("COMMON_003", "Operation not allowed in the current state", false),
    UNKNOWN("COMMON_999", "Unexpected error", false),

    INSUFFICIENT_STOCK("INVENTORY_001", "Insufficient stock", false),

    UNKNOWN_SAGA("SAGA_001", "Saga definition not registered", false),
    SAGA_OWNERSHIP_LOST("SAGA_002", "Saga execution was claimed by another worker", false),

    INSUFFICIENT_FUNDS("PAYMENT_001", "Insufficient funds for refund", false),
    GATEWAY_ERROR("PAYMENT_002", "Payment gateway error", true),
    NETWORK_ERROR("PAYMENT_003", "Network error while calling payment gateway", true),
    TIMEOUT_ERROR("PAYMENT_004", "Payment gateway timed out", true);

    private final String code;
    private final String defaultMessage;
    private final boolean retryable;

    ErrorCode(String code, String defaultMessage, boolean retryable) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.retryable = retryable;
    }

    public String getCode() { return code; }
    public String getDefaultMessage() { return defaultMessage; }
    public boolean isRetryable() { return retryable; }
}
