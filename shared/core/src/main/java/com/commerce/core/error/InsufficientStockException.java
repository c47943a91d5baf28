package com.commerce.core.error;

public class InsufficientStockException extends CommerceException {

    public InsufficientStockException(String message) {
        super(ErrorCode.INSUFFICIENT_STOCK, message);
    }
}
