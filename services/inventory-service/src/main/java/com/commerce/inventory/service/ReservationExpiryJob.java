package com.commerce.inventory.service;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "reservation.sweep.enabled", havingValue = "true", matchIfMissing = true)
public class ReservationExpiryJob {

    private final ReservationService reservationService;

    public ReservationExpiryJob(ReservationService reservationService) {
        this.reservationService = reservationService;
    }

    @Scheduled(fixedDelayString = "${reservation.sweep.interval-ms:60000}")
    public void sweep() {
        reservationService.sweepExpired();
    }
}
