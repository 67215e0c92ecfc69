package com.keer.studiosync.sync.controller;

import com.keer.studiosync.classifier.model.ClassifiedReservation;
import com.keer.studiosync.sync.connector.InboundMail;
import com.keer.studiosync.sync.dto.MessageClassificationResponse;
import com.keer.studiosync.sync.dto.RawMessageRequest;
import com.keer.studiosync.sync.service.MailIngestResult;
import com.keer.studiosync.sync.service.SyncService;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Feeds a single pasted message through the same path as the mail sync.
 */
@RestController
@Profile({"api", "default"})
@RequiredArgsConstructor
public class MessageController {

    private final SyncService syncService;

    @PostMapping("/api/messages/classify")
    public ResponseEntity<MessageClassificationResponse> classify(@RequestBody RawMessageRequest request) {
        InboundMail mail = new InboundMail(request.getMessageId(), request.getSender(),
                request.getSubject(), request.getBody());
        MailIngestResult result = syncService.ingestMail(mail);
        if (!result.isClassified()) {
            return ResponseEntity.ok(MessageClassificationResponse.builder().classified(false).build());
        }

        ClassifiedReservation classified = result.classified();
        return ResponseEntity.ok(MessageClassificationResponse.builder()
                .classified(true)
                .action(classified.action().name())
                .date(classified.date().toString())
                .start(classified.timeRange().start().toString())
                .end(classified.timeRange().end().toString())
                .customerName(classified.customerName())
                .studio(classified.studio())
                .confidence(classified.confidence())
                .outcome(result.isMerged() ? result.outcome().name() : null)
                .build());
    }
}
