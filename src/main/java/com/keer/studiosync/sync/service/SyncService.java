package com.keer.studiosync.sync.service;

import com.keer.studiosync.classifier.model.ClassifiedReservation;
import com.keer.studiosync.classifier.service.ReservationClassifier;
import com.keer.studiosync.config.ClassifierProperties;
import com.keer.studiosync.reservation.dto.WebhookBatchRequest;
import com.keer.studiosync.reservation.dto.WebhookReservationRequest;
import com.keer.studiosync.reservation.event.ReservationEvent;
import com.keer.studiosync.reservation.service.ReservationEventNormalizer;
import com.keer.studiosync.schedule.service.MergeOutcome;
import com.keer.studiosync.schedule.service.MergeSummary;
import com.keer.studiosync.schedule.service.ScheduleService;
import com.keer.studiosync.sync.connector.AutomationConnector;
import com.keer.studiosync.sync.connector.InboundMail;
import com.keer.studiosync.sync.connector.MailConnector;
import com.keer.studiosync.sync.connector.ScrapedReservation;
import com.keer.studiosync.sync.dto.SyncSummaryResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one sync per connector: fetch, classify, normalize, merge.
 * <p>
 * A connector that fails fails the whole run before anything is merged. Once merging has started every
 * event is applied on its own and nothing is rolled back.
 */
@Service
@Slf4j
public class SyncService {

    private final MailConnector mailConnector;
    private final AutomationConnector automationConnector;
    private final ReservationClassifier classifier;
    private final ReservationEventNormalizer normalizer;
    private final ScheduleService scheduleService;
    private final Clock clock;
    private final double minConfidence;
    private final int defaultDaysAhead;

    public SyncService(MailConnector mailConnector,
                       AutomationConnector automationConnector,
                       ReservationClassifier classifier,
                       ReservationEventNormalizer normalizer,
                       ScheduleService scheduleService,
                       Clock clock,
                       ClassifierProperties classifierProperties,
                       @Value("${app.automation.days-ahead:7}") int defaultDaysAhead) {
        this.mailConnector = mailConnector;
        this.automationConnector = automationConnector;
        this.classifier = classifier;
        this.normalizer = normalizer;
        this.scheduleService = scheduleService;
        this.clock = clock;
        this.minConfidence = classifierProperties.minConfidence();
        this.defaultDaysAhead = defaultDaysAhead;
    }

    public SyncSummaryResponse syncMail() {
        List<InboundMail> mails;
        try {
            mails = mailConnector.fetchRecent();
        } catch (RuntimeException e) {
            log.error("Mail sync failed while fetching messages", e);
            throw new SyncFailedException("Mail sync failed", e);
        }

        int accepted = 0;
        List<MergeOutcome> outcomes = new ArrayList<>();
        for (InboundMail mail : mails) {
            MailIngestResult result = ingestMail(mail);
            if (result.isMerged()) {
                accepted++;
                outcomes.add(result.outcome());
            }
        }

        MergeSummary summary = MergeSummary.of(outcomes);
        log.info("Mail sync: {} fetched, {} accepted, {}", mails.size(), accepted, summary);
        return toResponse("mail", mails.size(), accepted, summary);
    }

    /**
     * Classifies one message and merges it when it clears the confidence threshold.
     */
    public MailIngestResult ingestMail(InboundMail mail) {
        ClassifiedReservation classified = classifier.classify(mail.subject(), mail.body());
        if (classified == null) {
            return MailIngestResult.REJECTED;
        }
        if (classified.confidence() <= minConfidence) {
            log.debug("Below confidence threshold ({} <= {}): {}", classified.confidence(), minConfidence, mail.subject());
            return new MailIngestResult(classified, null);
        }

        ReservationEvent event = normalizer.fromMail(classified, mail);
        MergeOutcome outcome = scheduleService.apply(event);
        if (outcome.changedSchedule() && mail.messageId() != null) {
            markProcessed(mail.messageId(), event);
        }
        return new MailIngestResult(classified, outcome);
    }

    public SyncSummaryResponse syncAutomation(Integer days) {
        int daysAhead = days == null ? defaultDaysAhead : days;
        if (daysAhead < 0) {
            throw new IllegalArgumentException("days must not be negative: " + daysAhead);
        }
        LocalDate from = LocalDate.now(clock);
        LocalDate to = from.plusDays(daysAhead);

        List<ScrapedReservation> scraped;
        try {
            scraped = automationConnector.fetch(from, to);
        } catch (RuntimeException e) {
            log.error("Automation sync failed while fetching {} to {}", from, to, e);
            throw new SyncFailedException("Automation sync failed", e);
        }

        List<ReservationEvent> events = scraped.stream()
                .map(normalizer::fromScraped)
                .toList();
        MergeSummary summary = scheduleService.applyAll(events);
        log.info("Automation sync {} to {}: {} fetched, {}", from, to, scraped.size(), summary);
        return toResponse("automation", scraped.size(), events.size(), summary);
    }

    /**
     * Merges a batch pushed by the mailbox script. Every record is validated before the first one is applied.
     *
     * @throws IllegalArgumentException when the batch or one of its records is malformed
     */
    public SyncSummaryResponse applyWebhook(WebhookBatchRequest batch) {
        if (batch == null || batch.getReservations() == null) {
            throw new IllegalArgumentException("reservations are required");
        }
        List<ReservationEvent> events = new ArrayList<>(batch.getReservations().size());
        for (WebhookReservationRequest request : batch.getReservations()) {
            if (request == null) {
                throw new IllegalArgumentException("reservation " + (events.size() + 1) + " is empty");
            }
            events.add(normalizer.fromWebhook(request));
        }
        MergeSummary summary = scheduleService.applyAll(events);
        log.info("Webhook batch: {}", summary);
        return toResponse("webhook", events.size(), events.size(), summary);
    }

    private void markProcessed(String messageId, ReservationEvent event) {
        try {
            mailConnector.markProcessed(messageId, event.getAction());
        } catch (RuntimeException e) {
            // the merge is done; the worst case is the message being skipped as a duplicate next run
            log.warn("Could not mark message {} as processed: {}", messageId, e.getMessage());
        }
    }

    private static SyncSummaryResponse toResponse(String source, int fetched, int accepted, MergeSummary summary) {
        return SyncSummaryResponse.builder()
                .source(source)
                .fetched(fetched)
                .accepted(accepted)
                .added(summary.added())
                .cancelled(summary.cancelled())
                .skipped(summary.skipped())
                .notFound(summary.notFound())
                .build();
    }
}
