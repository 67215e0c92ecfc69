package com.keer.studiosync.config;

public final class KafkaConstants {

    private KafkaConstants() {}

    public static final String TOPIC_SLOT_CHANGES = "slot-changes";
}
