package com.keer.studiosync.sync.connector;

import com.keer.studiosync.schedule.model.SlotType;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A booking as listed by the scheduling portal. Type and status are already mapped by the scraper;
 * {@code end} may be missing for blocks the portal shows without a duration.
 */
public record ScrapedReservation(
        LocalDate date,
        LocalTime start,
        LocalTime end,
        SlotType type,
        String status,
        String customerName) {
}
