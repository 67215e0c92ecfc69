package com.keer.studiosync.schedule.service;

import com.keer.studiosync.reservation.event.ReservationEvent;
import com.keer.studiosync.schedule.model.Slot;

import java.util.Objects;

/**
 * When an incoming booking counts as already stored on its date.
 */
public enum DuplicateRule {

    START_AND_CUSTOMER {
        @Override
        public boolean matches(Slot existing, ReservationEvent event) {
            return existing.getStart().equals(event.getStart())
                    && Objects.equals(existing.getCustomerName(), event.getCustomerName());
        }
    },

    START_END_AND_CUSTOMER {
        @Override
        public boolean matches(Slot existing, ReservationEvent event) {
            return START_AND_CUSTOMER.matches(existing, event)
                    && Objects.equals(existing.getEnd(), event.getEnd());
        }
    },

    // the portal lists every booking of a slot on its own, so customers are not compared
    START_AND_SOURCE {
        @Override
        public boolean matches(Slot existing, ReservationEvent event) {
            return existing.getStart().equals(event.getStart())
                    && existing.getSource() == event.getSource();
        }
    };

    public abstract boolean matches(Slot existing, ReservationEvent event);
}
