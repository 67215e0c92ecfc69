package com.keer.studiosync.sync.service;

import com.keer.studiosync.classifier.model.ClassifiedReservation;
import com.keer.studiosync.classifier.model.TimeRange;
import com.keer.studiosync.classifier.service.ReservationClassifier;
import com.keer.studiosync.config.ClassifierProperties;
import com.keer.studiosync.reservation.dto.WebhookBatchRequest;
import com.keer.studiosync.reservation.dto.WebhookReservationRequest;
import com.keer.studiosync.reservation.event.ReservationEvent;
import com.keer.studiosync.reservation.model.EventSource;
import com.keer.studiosync.reservation.model.ReservationAction;
import com.keer.studiosync.reservation.service.ReservationEventNormalizer;
import com.keer.studiosync.schedule.model.SlotType;
import com.keer.studiosync.schedule.service.MergeOutcome;
import com.keer.studiosync.schedule.service.MergeSummary;
import com.keer.studiosync.schedule.service.ScheduleService;
import com.keer.studiosync.sync.connector.AutomationConnector;
import com.keer.studiosync.sync.connector.ConnectorException;
import com.keer.studiosync.sync.connector.InboundMail;
import com.keer.studiosync.sync.connector.MailConnector;
import com.keer.studiosync.sync.connector.ScrapedReservation;
import com.keer.studiosync.sync.dto.SyncSummaryResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SyncServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 10, 1);

    @Mock
    private MailConnector mailConnector;

    @Mock
    private AutomationConnector automationConnector;

    @Mock
    private ReservationClassifier classifier;

    @Mock
    private ScheduleService scheduleService;

    private SyncService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-10-01T00:00:00Z"), ZoneId.of("Asia/Tokyo"));
        service = new SyncService(mailConnector, automationConnector, classifier, new ReservationEventNormalizer(),
                scheduleService, clock, ClassifierProperties.defaults(), 7);
    }

    private static InboundMail mail(String id) {
        return new InboundMail(id, "noreply@example.com", "HALLELよりご予約確認", "body " + id);
    }

    private static ClassifiedReservation classified(double confidence) {
        return new ClassifiedReservation(ReservationAction.BOOKING, LocalDate.of(2025, 11, 2),
                new TimeRange(LocalTime.of(10, 0), LocalTime.of(11, 0), false), "田中", "unknown", confidence);
    }

    @Nested
    class MailSync {

        @Test
        void shouldMergeConfidentMailsOnly() {
            when(mailConnector.fetchRecent()).thenReturn(List.of(mail("m1"), mail("m2"), mail("m3")));
            when(classifier.classify(anyString(), eq("body m1"))).thenReturn(classified(0.9));
            when(classifier.classify(anyString(), eq("body m2"))).thenReturn(classified(0.7));
            when(classifier.classify(anyString(), eq("body m3"))).thenReturn(null);
            when(scheduleService.apply(any())).thenReturn(MergeOutcome.ADDED);

            SyncSummaryResponse summary = service.syncMail();

            assertEquals(3, summary.getFetched());
            assertEquals(1, summary.getAccepted());
            assertEquals(1, summary.getAdded());
            verify(scheduleService, times(1)).apply(any());
            verify(mailConnector).markProcessed("m1", ReservationAction.BOOKING);
        }

        @Test
        void shouldCarryMailMetadataIntoEvent() {
            when(mailConnector.fetchRecent()).thenReturn(List.of(mail("m1")));
            when(classifier.classify(anyString(), anyString())).thenReturn(classified(0.9));
            when(scheduleService.apply(any())).thenReturn(MergeOutcome.SKIPPED_DUPLICATE);

            SyncSummaryResponse summary = service.syncMail();

            ArgumentCaptor<ReservationEvent> captor = ArgumentCaptor.forClass(ReservationEvent.class);
            verify(scheduleService).apply(captor.capture());
            ReservationEvent event = captor.getValue();
            assertEquals(EventSource.EXTERNAL_MAIL, event.getSource());
            assertEquals("m1", event.getMessageId());
            assertEquals("noreply@example.com", event.getSender());
            assertEquals(0.9, event.getConfidence());
            assertEquals(1, summary.getSkipped());
            verify(mailConnector, never()).markProcessed(anyString(), any());
        }

        @Test
        void shouldFailRunWhenMailboxIsUnreachable() {
            when(mailConnector.fetchRecent()).thenThrow(new ConnectorException("invalid_grant: token expired"));

            SyncFailedException e = assertThrows(SyncFailedException.class, () -> service.syncMail());

            assertEquals("Mail sync failed", e.getMessage());
            verifyNoInteractions(scheduleService);
        }

        @Test
        void shouldKeepMergeWhenLabellingFails() {
            when(mailConnector.fetchRecent()).thenReturn(List.of(mail("m1")));
            when(classifier.classify(anyString(), anyString())).thenReturn(classified(0.9));
            when(scheduleService.apply(any())).thenReturn(MergeOutcome.ADDED);
            doThrow(new ConnectorException("label missing")).when(mailConnector).markProcessed(anyString(), any());

            assertEquals(1, service.syncMail().getAdded());
        }
    }

    @Nested
    class AutomationSync {

        @Test
        void shouldFetchConfiguredWindowAndMergeAsBookings() {
            ScrapedReservation scraped = new ScrapedReservation(TODAY, LocalTime.of(9, 0), null,
                    SlotType.CHARTER, "confirmed", "山田");
            when(automationConnector.fetch(TODAY, TODAY.plusDays(7))).thenReturn(List.of(scraped));
            when(scheduleService.applyAll(anyList())).thenReturn(new MergeSummary(1, 0, 0, 0));

            SyncSummaryResponse summary = service.syncAutomation(null);

            assertEquals(1, summary.getAdded());
            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<ReservationEvent>> captor = ArgumentCaptor.forClass(List.class);
            verify(scheduleService).applyAll(captor.capture());
            ReservationEvent event = captor.getValue().get(0);
            assertEquals(EventSource.AUTOMATION_SYNC, event.getSource());
            assertEquals(LocalTime.of(10, 0), event.getEnd());
            assertEquals(SlotType.CHARTER, event.getType());
        }

        @Test
        void shouldUseRequestedWindow() {
            when(automationConnector.fetch(TODAY, TODAY.plusDays(3))).thenReturn(List.of());
            when(scheduleService.applyAll(anyList())).thenReturn(MergeSummary.EMPTY);

            assertEquals(0, service.syncAutomation(3).getFetched());
        }

        @Test
        void shouldRejectNegativeWindow() {
            assertThrows(IllegalArgumentException.class, () -> service.syncAutomation(-1));
            verifyNoInteractions(automationConnector);
        }

        @Test
        void shouldFailRunWhenPortalIsUnreachable() {
            when(automationConnector.fetch(any(), any())).thenThrow(new ConnectorException("login failed"));

            assertThrows(SyncFailedException.class, () -> service.syncAutomation(null));
            verifyNoInteractions(scheduleService);
        }
    }

    @Nested
    class Webhook {

        @Test
        void shouldMergeWholeBatch() {
            WebhookBatchRequest batch = new WebhookBatchRequest(List.of(
                    WebhookReservationRequest.builder().date("2025-11-02").start("10:00").end("11:00")
                            .customerName("田中").messageId("e1").build(),
                    WebhookReservationRequest.builder().date("2025-11-02").start("10:00")
                            .cancellation(true).build()));
            when(scheduleService.applyAll(anyList())).thenReturn(new MergeSummary(1, 1, 0, 0));

            SyncSummaryResponse summary = service.applyWebhook(batch);

            assertEquals(2, summary.getFetched());
            assertEquals(1, summary.getCancelled());
        }

        @Test
        void shouldValidateEveryRecordBeforeMerging() {
            WebhookBatchRequest batch = new WebhookBatchRequest(List.of(
                    WebhookReservationRequest.builder().date("2025-11-02").start("10:00").end("11:00").build(),
                    WebhookReservationRequest.builder().start("12:00").end("13:00").build()));

            assertThrows(IllegalArgumentException.class, () -> service.applyWebhook(batch));
            verifyNoInteractions(scheduleService);
        }

        @Test
        void shouldRejectNullRecord() {
            WebhookBatchRequest batch = new WebhookBatchRequest(Arrays.asList(
                    WebhookReservationRequest.builder().date("2025-11-02").start("10:00").end("11:00").build(),
                    null));

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> service.applyWebhook(batch));
            assertEquals("reservation 2 is empty", e.getMessage());
            verifyNoInteractions(scheduleService);
        }

        @Test
        void shouldRejectMissingReservations() {
            assertThrows(IllegalArgumentException.class, () -> service.applyWebhook(new WebhookBatchRequest()));
        }
    }
}
