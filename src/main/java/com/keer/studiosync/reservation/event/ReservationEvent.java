package com.keer.studiosync.reservation.event;

import com.keer.studiosync.reservation.model.EventSource;
import com.keer.studiosync.reservation.model.ReservationAction;
import com.keer.studiosync.schedule.model.SlotType;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Canonical booking or cancellation intent, whatever connector it came from.
 * A booking always carries date, start and end; the builder refuses anything less.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ReservationEvent {

    public static final String UNKNOWN_CUSTOMER = "N/A";
    public static final String UNKNOWN_RESOURCE = "unknown";

    private final ReservationAction action;
    private final LocalDate date;
    private final LocalTime start;
    private final LocalTime end;
    private final String customerName;
    private final String resource;
    private final SlotType type;
    private final EventSource source;
    private final double confidence;
    private final String messageId;
    private final String sender;
    private final String subject;

    @Builder(toBuilder = true)
    private ReservationEvent(ReservationAction action, LocalDate date, LocalTime start, LocalTime end,
                             String customerName, String resource, SlotType type, EventSource source,
                             Double confidence, String messageId, String sender, String subject) {
        if (action == null) {
            throw new IllegalArgumentException("action is required");
        }
        if (date == null || start == null) {
            throw new IllegalArgumentException("date and start are required for " + action);
        }
        if (action == ReservationAction.BOOKING && end == null) {
            throw new IllegalArgumentException("end is required for a booking on " + date + " " + start);
        }
        if (source == null) {
            throw new IllegalArgumentException("source is required");
        }
        double score = confidence == null ? 1.0 : confidence;
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("confidence out of range: " + score);
        }
        this.action = action;
        this.date = date;
        this.start = start;
        this.end = end;
        this.customerName = customerName == null || customerName.isBlank() ? UNKNOWN_CUSTOMER : customerName.trim();
        this.resource = resource == null || resource.isBlank() ? UNKNOWN_RESOURCE : resource;
        this.type = type == null ? SlotType.ORDINARY : type;
        this.source = source;
        this.confidence = score;
        this.messageId = messageId;
        this.sender = sender;
        this.subject = subject;
    }

    public boolean isBooking() {
        return action == ReservationAction.BOOKING;
    }

    public String timeRange() {
        return end == null ? start.toString() : start + "-" + end;
    }
}
