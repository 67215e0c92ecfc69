package com.keer.studiosync.schedule.service;

import java.util.Collection;

public record MergeSummary(int added, int cancelled, int skipped, int notFound) {

    public static final MergeSummary EMPTY = new MergeSummary(0, 0, 0, 0);

    public static MergeSummary of(Collection<MergeOutcome> outcomes) {
        int added = 0;
        int cancelled = 0;
        int skipped = 0;
        int notFound = 0;
        for (MergeOutcome outcome : outcomes) {
            if (outcome == MergeOutcome.ADDED) {
                added++;
            } else if (outcome == MergeOutcome.CANCELLED) {
                cancelled++;
            } else if (outcome == MergeOutcome.SKIPPED_DUPLICATE) {
                skipped++;
            } else {
                notFound++;
            }
        }
        return new MergeSummary(added, cancelled, skipped, notFound);
    }

    public int total() {
        return added + cancelled + skipped + notFound;
    }
}
