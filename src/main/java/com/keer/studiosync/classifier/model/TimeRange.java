package com.keer.studiosync.classifier.model;

import java.time.LocalTime;

/**
 * Start and end of a booking as found in a message.
 * {@code synthesized} is set when only the start was written and the end was derived from it.
 */
public record TimeRange(LocalTime start, LocalTime end, boolean synthesized) {

    public boolean crossesMidnight() {
        return end.isBefore(start);
    }
}
