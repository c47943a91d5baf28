package com.commerce.events;

public final class AggregateTypes {
    private AggregateTypes() {}

    public static final String SAGA = "Saga";
    public static final String RESERVATION = "Reservation";
    public static final String REFUND = "Refund";
}
