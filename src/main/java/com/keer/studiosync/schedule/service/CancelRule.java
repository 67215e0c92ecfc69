package com.keer.studiosync.schedule.service;

import com.keer.studiosync.reservation.event.ReservationEvent;
import com.keer.studiosync.schedule.model.Slot;

import java.util.Objects;

/**
 * Which stored slot a cancellation refers to. The first slot in insertion order that matches is removed.
 */
public enum CancelRule {

    START_AND_CUSTOMER {
        @Override
        public boolean matches(Slot existing, ReservationEvent event) {
            return existing.getStart().equals(event.getStart())
                    && Objects.equals(existing.getCustomerName(), event.getCustomerName());
        }
    },

    START_AND_TYPE {
        @Override
        public boolean matches(Slot existing, ReservationEvent event) {
            return existing.getStart().equals(event.getStart())
                    && existing.getType() == event.getType();
        }
    };

    public abstract boolean matches(Slot existing, ReservationEvent event);
}
