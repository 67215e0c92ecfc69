package com.keer.studiosync.classifier.model;

import com.keer.studiosync.reservation.model.ReservationAction;

/**
 * Independent evidence collected while classifying one message.
 * Weights are kept in hundredths so the sum stays exact before it is clamped.
 */
public record ConfidenceSignals(
        ReservationAction action,
        int keywordHits,
        boolean structuredDate,
        boolean structuredTime,
        boolean brandLiteral) {

    static final int BASE = 50;
    static final int BOOKING_KEYWORD_WEIGHT = 10;
    static final int CANCELLATION_KEYWORD_WEIGHT = 15;
    static final int STRUCTURED_DATE_WEIGHT = 10;
    static final int STRUCTURED_TIME_WEIGHT = 10;
    static final int BRAND_LITERAL_WEIGHT = 10;

    public double score() {
        int keywordWeight = action == ReservationAction.CANCELLATION
                ? CANCELLATION_KEYWORD_WEIGHT
                : BOOKING_KEYWORD_WEIGHT;
        int total = BASE + keywordHits * keywordWeight;
        if (structuredDate) {
            total += STRUCTURED_DATE_WEIGHT;
        }
        if (structuredTime) {
            total += STRUCTURED_TIME_WEIGHT;
        }
        if (brandLiteral) {
            total += BRAND_LITERAL_WEIGHT;
        }
        return Math.min(total, 100) / 100.0;
    }
}
