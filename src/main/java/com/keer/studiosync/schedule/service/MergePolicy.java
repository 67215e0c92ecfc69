package com.keer.studiosync.schedule.service;

import com.keer.studiosync.reservation.model.EventSource;

/**
 * Duplicate and cancellation matching used for one event source.
 */
public record MergePolicy(DuplicateRule duplicateRule, CancelRule cancelRule) {

    public static final MergePolicy CUSTOMER_KEYED =
            new MergePolicy(DuplicateRule.START_AND_CUSTOMER, CancelRule.START_AND_CUSTOMER);
    public static final MergePolicy WEBHOOK =
            new MergePolicy(DuplicateRule.START_END_AND_CUSTOMER, CancelRule.START_AND_TYPE);
    public static final MergePolicy AUTOMATION =
            new MergePolicy(DuplicateRule.START_AND_SOURCE, CancelRule.START_AND_CUSTOMER);

    public MergePolicy {
        if (duplicateRule == null || cancelRule == null) {
            throw new IllegalArgumentException("both rules are required");
        }
    }

    public static MergePolicy forSource(EventSource source) {
        if (source == EventSource.INTEGRATION_WEBHOOK) {
            return WEBHOOK;
        }
        if (source == EventSource.AUTOMATION_SYNC) {
            return AUTOMATION;
        }
        return CUSTOMER_KEYED;
    }
}
