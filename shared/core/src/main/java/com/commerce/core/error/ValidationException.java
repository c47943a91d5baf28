package com.commerce.core.error;

public class ValidationException extends CommerceException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_FAILED, message);
    }
}
