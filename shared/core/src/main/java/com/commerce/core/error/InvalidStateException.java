package com.commerce.core.error;

public class InvalidStateException extends CommerceException {

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }
}
