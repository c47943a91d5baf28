package com.commerce.saga.orchestration;

import com.commerce.core.error.CommerceException;
import com.commerce.core.error.ErrorCode;
import com.commerce.events.serde.EventObjectMapper;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.time.Duration;

public record StepResult(Outcome outcome, JsonNode data, String error, ErrorCode errorCode, Duration retryAfter) {

    public enum Outcome {
        SUCCESS,
        FAILURE,
        RETRY
    }

    public static StepResult success(Object data) {
        JsonNode node = data == null ? NullNode.getInstance() : EventObjectMapper.instance().valueToTree(data);
        return new StepResult(Outcome.SUCCESS, node, null, null, null);
    }

    public static StepResult failure(String error, ErrorCode errorCode) {
        return new StepResult(Outcome.FAILURE, null, error, errorCode, null);
    }

    public static StepResult failure(Throwable error) {
        return failure(String.valueOf(error.getMessage()), CommerceException.classify(error));
    }

    /** Leaves the saga RUNNING and asks for the same step to run again after {@code delay}. */
    public static StepResult retry(Duration delay, Throwable error) {
        return new StepResult(Outcome.RETRY, null, String.valueOf(error.getMessage()),
                CommerceException.classify(error), delay);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
