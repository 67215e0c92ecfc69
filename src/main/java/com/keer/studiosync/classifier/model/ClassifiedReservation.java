package com.keer.studiosync.classifier.model;

import com.keer.studiosync.reservation.model.ReservationAction;

import java.time.LocalDate;

public record ClassifiedReservation(
        ReservationAction action,
        LocalDate date,
        TimeRange timeRange,
        String customerName,
        String studio,
        double confidence) {
}
