package com.commerce.saga.orchestration;

import com.commerce.core.error.CommerceException;
import com.commerce.core.error.ErrorCode;

public class UnknownSagaException extends CommerceException {

    public UnknownSagaException(String sagaType) {
        super(ErrorCode.UNKNOWN_SAGA, "No saga registered for type " + sagaType);
    }
}
