package com.commerce.saga.payment;

import com.commerce.core.error.CommerceException;
import com.commerce.core.error.ErrorCode;

public class GatewayTimeoutException extends CommerceException {

    public GatewayTimeoutException(String message) {
        super(ErrorCode.TIMEOUT_ERROR, message);
    }
}
