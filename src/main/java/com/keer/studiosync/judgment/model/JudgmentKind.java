package com.keer.studiosync.judgment.model;

public enum JudgmentKind {
    BOOKING,
    CANCELLATION,
    // operator annotations
    MANUAL,
    CLEAR,
    EXPORT
}
