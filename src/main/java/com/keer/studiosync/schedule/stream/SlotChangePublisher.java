package com.keer.studiosync.schedule.stream;

import com.keer.studiosync.config.KafkaConstants;
import com.keer.studiosync.schedule.event.SlotChangedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes schedule changes keyed by date. A failed send is logged and never fails the merge that caused it.
 */
@Component
@Slf4j
public class SlotChangePublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final boolean enabled;

    public SlotChangePublisher(KafkaTemplate<String, Object> kafkaTemplate,
                               @Value("${app.slot-changes.enabled:true}") boolean enabled) {
        this.kafkaTemplate = kafkaTemplate;
        this.enabled = enabled;
    }

    public void publish(SlotChangedEvent change) {
        if (!enabled) {
            return;
        }
        try {
            kafkaTemplate.send(KafkaConstants.TOPIC_SLOT_CHANGES, change.getDate(), change)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Failed to publish {} for {}: {}", change.getChangeType(), change.getDate(), ex.getMessage());
                        }
                    });
        } catch (RuntimeException e) {
            log.warn("Failed to publish {} for {}: {}", change.getChangeType(), change.getDate(), e.getMessage());
        }
    }
}
