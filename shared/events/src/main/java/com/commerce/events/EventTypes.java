package com.commerce.events;

public final class EventTypes {
    private EventTypes() {}

    public static final String SAGA_STARTED = "SagaStarted";
    public static final String SAGA_STEP_COMPLETED = "SagaStepCompleted";
    public static final String SAGA_STEP_COMPENSATED = "SagaStepCompensated";
    public static final String SAGA_STEP_COMPENSATION_FAILED = "SagaStepCompensationFailed";
    public static final String SAGA_COMPLETED = "SagaCompleted";
    public static final String SAGA_COMPENSATED = "SagaCompensated";
    public static final String SAGA_FAILED = "SagaFailed";

    public static final String RESERVATION_CREATED = "ReservationCreated";
    public static final String RESERVATION_COMMITTED = "ReservationCommitted";
    public static final String RESERVATION_RELEASED = "ReservationReleased";
    public static final String RESERVATION_EXPIRED = "ReservationExpired";

    public static final String REFUND_CREATED = "RefundCreated";
    public static final String REFUND_COMPLETED = "RefundCompleted";
}
