package com.keer.studiosync.reservation.service;

import com.keer.studiosync.classifier.model.ClassifiedReservation;
import com.keer.studiosync.reservation.dto.ManualReservationRequest;
import com.keer.studiosync.reservation.dto.WebhookReservationRequest;
import com.keer.studiosync.reservation.event.ReservationEvent;
import com.keer.studiosync.reservation.model.EventSource;
import com.keer.studiosync.reservation.model.ReservationAction;
import com.keer.studiosync.schedule.model.SlotType;
import com.keer.studiosync.sync.connector.InboundMail;
import com.keer.studiosync.sync.connector.ScrapedReservation;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

/**
 * Maps connector specific records onto {@link ReservationEvent}. Renames and defaults fields only.
 */
@Component
public class ReservationEventNormalizer {

    public static final int SUBJECT_PREVIEW_LENGTH = 100;
    public static final String MANUAL_CUSTOMER = "手動入力";

    // accepts "9:00" as well as "09:00"
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("H:mm");

    public ReservationEvent fromMail(ClassifiedReservation classified, InboundMail mail) {
        return ReservationEvent.builder()
                .action(classified.action())
                .date(classified.date())
                .start(classified.timeRange().start())
                .end(classified.timeRange().end())
                .customerName(classified.customerName())
                .resource(classified.studio())
                .type(SlotType.ORDINARY)
                .source(EventSource.EXTERNAL_MAIL)
                .confidence(classified.confidence())
                .messageId(mail.messageId())
                .sender(mail.sender())
                .subject(preview(mail.subject()))
                .build();
    }

    public ReservationEvent fromScraped(ScrapedReservation scraped) {
        // the portal lists some blocks without an end; it books by the hour
        LocalTime end = scraped.end() != null ? scraped.end() : scraped.start().plusHours(1);
        return ReservationEvent.builder()
                .action(ReservationAction.BOOKING)
                .date(scraped.date())
                .start(scraped.start())
                .end(end)
                .customerName(scraped.customerName())
                .type(scraped.type())
                .source(EventSource.AUTOMATION_SYNC)
                .confidence(1.0)
                .build();
    }

    public ReservationEvent fromWebhook(WebhookReservationRequest request) {
        return ReservationEvent.builder()
                .action(request.isCancellation() ? ReservationAction.CANCELLATION : ReservationAction.BOOKING)
                .date(parseDate(request.getDate()))
                .start(parseTime(request.getStart()))
                .end(parseTime(request.getEnd()))
                .customerName(request.getCustomerName())
                .type(SlotType.fromValue(request.getType()))
                .source(EventSource.INTEGRATION_WEBHOOK)
                .confidence(1.0)
                .messageId(request.getMessageId())
                .build();
    }

    public ReservationEvent fromManual(ManualReservationRequest request) {
        String customer = request.getCustomerName() == null || request.getCustomerName().isBlank()
                ? MANUAL_CUSTOMER
                : request.getCustomerName();
        return ReservationEvent.builder()
                .action(request.isCancellation() ? ReservationAction.CANCELLATION : ReservationAction.BOOKING)
                .date(parseDate(request.getDate()))
                .start(parseTime(request.getStart()))
                .end(parseTime(request.getEnd()))
                .customerName(customer)
                .type(SlotType.fromValue(request.getType()))
                .source(EventSource.MANUAL)
                .confidence(1.0)
                .build();
    }

    static String preview(String subject) {
        if (subject == null || subject.length() <= SUBJECT_PREVIEW_LENGTH) {
            return subject;
        }
        return subject.substring(0, SUBJECT_PREVIEW_LENGTH);
    }

    private static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("date is required");
        }
        return LocalDate.parse(value.strip());
    }

    private static LocalTime parseTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return LocalTime.parse(value.strip(), TIME);
    }
}
