package com.keer.studiosync.sync.service;

import com.keer.studiosync.classifier.model.ClassifiedReservation;
import com.keer.studiosync.schedule.service.MergeOutcome;

/**
 * What became of one message. {@code classified} is null for a rejected message,
 * {@code outcome} is null when the message was not merged.
 */
public record MailIngestResult(ClassifiedReservation classified, MergeOutcome outcome) {

    public static final MailIngestResult REJECTED = new MailIngestResult(null, null);

    public boolean isClassified() {
        return classified != null;
    }

    public boolean isMerged() {
        return outcome != null;
    }
}
