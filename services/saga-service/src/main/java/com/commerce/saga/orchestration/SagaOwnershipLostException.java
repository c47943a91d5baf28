package com.commerce.saga.orchestration;

import com.commerce.core.error.CommerceException;
import com.commerce.core.error.ErrorCode;

import java.util.UUID;

public class SagaOwnershipLostException extends CommerceException {

    public SagaOwnershipLostException(UUID sagaId) {
        super(ErrorCode.SAGA_OWNERSHIP_LOST, "Saga " + sagaId + " is now driven by another worker");
    }
}
