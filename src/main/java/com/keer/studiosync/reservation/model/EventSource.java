package com.keer.studiosync.reservation.model;

public enum EventSource {
    MANUAL("手動入力"),
    EXTERNAL_MAIL("メール自動"),
    AUTOMATION_SYNC("自動同期"),
    INTEGRATION_WEBHOOK("Webhook");

    private final String displayName;

    EventSource(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
