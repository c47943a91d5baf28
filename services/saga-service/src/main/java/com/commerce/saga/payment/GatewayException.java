package com.commerce.saga.payment;

import com.commerce.core.error.CommerceException;
import com.commerce.core.error.ErrorCode;

public class GatewayException extends CommerceException {

    public GatewayException(String message) {
        super(ErrorCode.GATEWAY_ERROR, message);
    }
}
