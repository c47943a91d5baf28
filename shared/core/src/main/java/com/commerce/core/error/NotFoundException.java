package com.commerce.core.error;

public class NotFoundException extends CommerceException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
