package com.commerce.core.error;

public class CommerceException extends RuntimeException {

    private final ErrorCode errorCode;

    public CommerceException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    public CommerceException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CommerceException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }

    /**
     * Classifies any failure into the taxonomy. Foreign exceptions map to {@link ErrorCode#UNKNOWN}.
     */
    public static ErrorCode classify(Throwable error) {
        if (error instanceof CommerceException commerceException) {
            return commerceException.getErrorCode();
        }
        return ErrorCode.UNKNOWN;
    }
}
