package com.commerce.saga.payment;

import com.commerce.core.error.CommerceException;
import com.commerce.core.error.ErrorCode;

public class NetworkException extends CommerceException {

    public NetworkException(String message) {
        super(ErrorCode.NETWORK_ERROR, message);
    }
}
