package com.keer.studiosync.schedule.model;

import java.util.Locale;

public enum SlotType {
    ORDINARY("通常予約"),
    CHARTER("貸切予約"),
    BLOCK("ブロック"),
    UNKNOWN("不明");

    private final String displayName;

    SlotType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    // Lenient lookup for connector payloads: "charter", "BLOCK", null ...
    public static SlotType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ORDINARY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
