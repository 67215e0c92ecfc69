package com.keer.studiosync.schedule.stream;

import com.keer.studiosync.config.KafkaConstants;
import com.keer.studiosync.schedule.event.SlotChangedEvent;
import com.keer.studiosync.schedule.service.ScheduleSseService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

@Component
@Profile({"api", "default"})
@RequiredArgsConstructor
@Slf4j
public class SlotChangeListener {

    private final ScheduleSseService scheduleSseService;

    // every instance relays to its own subscribers, so each one needs its own group
    @KafkaListener(topics = KafkaConstants.TOPIC_SLOT_CHANGES, groupId = "slot-change-sse-${random.uuid}",
            autoStartup = "${app.slot-changes.enabled:true}")
    public void onSlotChanged(SlotChangedEvent change) {
        if (change.getDate() == null) {
            log.warn("Skipping slot change without a date: {}", change);
            return;
        }
        LocalDate date;
        try {
            date = LocalDate.parse(change.getDate());
        } catch (DateTimeParseException e) {
            log.warn("Skipping slot change with invalid date: {}", change);
            return;
        }
        log.debug("Relaying {} on {} to {} subscriber(s)", change.getChangeType(), date,
                scheduleSseService.subscriberCount(date));
        scheduleSseService.broadcast(date, change);
    }
}
