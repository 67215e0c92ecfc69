package com.keer.studiosync.judgment.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One line of the judgment log. Operator annotations leave date, time range, customer and confidence empty.
 */
public record JudgmentEntry(
        @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss") LocalDateTime timestamp,
        JudgmentKind kind,
        LocalDate date,
        String timeRange,
        String customerName,
        Double confidence,
        String note) {
}
