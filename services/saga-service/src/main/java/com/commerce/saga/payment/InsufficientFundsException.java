package com.commerce.saga.payment;

import com.commerce.core.error.CommerceException;
import com.commerce.core.error.ErrorCode;

public class InsufficientFundsException extends CommerceException {

    public InsufficientFundsException(String message) {
        super(ErrorCode.INSUFFICIENT_FUNDS, message);
    }
}
