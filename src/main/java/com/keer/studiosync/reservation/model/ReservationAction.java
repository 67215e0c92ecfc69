package com.keer.studiosync.reservation.model;

public enum ReservationAction {
    BOOKING, CANCELLATION
}
