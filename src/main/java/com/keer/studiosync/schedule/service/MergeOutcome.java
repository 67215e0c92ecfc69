package com.keer.studiosync.schedule.service;

public enum MergeOutcome {
    ADDED,
    CANCELLED,
    SKIPPED_DUPLICATE,
    CANCEL_NOT_FOUND;

    public boolean changedSchedule() {
        return this == ADDED || this == CANCELLED;
    }
}
