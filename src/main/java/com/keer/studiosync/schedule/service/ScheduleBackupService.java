package com.keer.studiosync.schedule.service;

import com.keer.studiosync.schedule.dto.RestoreResultResponse;
import com.keer.studiosync.schedule.dto.ScheduleBackup;
import com.keer.studiosync.schedule.event.SlotChangedEvent;
import com.keer.studiosync.schedule.model.Slot;
import com.keer.studiosync.schedule.repository.ScheduleStore;
import com.keer.studiosync.schedule.stream.SlotChangePublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Exports the schedule as one document and loads such a document back, replacing what is stored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleBackupService {

    private final ScheduleStore scheduleStore;
    private final MergeEngine mergeEngine;
    private final SlotChangePublisher slotChangePublisher;
    private final Clock clock;

    public ScheduleBackup export() {
        Map<String, List<Slot>> slots = new LinkedHashMap<>();
        int total = 0;
        for (Map.Entry<LocalDate, List<Slot>> entry : scheduleStore.findAll().entrySet()) {
            slots.put(entry.getKey().toString(), entry.getValue());
            total += entry.getValue().size();
        }
        return new ScheduleBackup(LocalDateTime.now(clock).withNano(0).toString(), total, slots);
    }

    /**
     * Slots are restored as they were exported; group numbers and order are kept, no merge rules run.
     *
     * @throws IllegalArgumentException when a key is not an ISO date or a slot has no start
     */
    public RestoreResultResponse restore(ScheduleBackup backup) {
        if (backup == null || backup.getSlots() == null) {
            throw new IllegalArgumentException("backup has no slots");
        }
        SortedMap<LocalDate, List<Slot>> slots = new TreeMap<>();
        int total = 0;
        for (Map.Entry<String, List<Slot>> entry : backup.getSlots().entrySet()) {
            LocalDate date = LocalDate.parse(entry.getKey());
            List<Slot> list = entry.getValue() == null ? List.of() : entry.getValue();
            for (Slot slot : list) {
                if (slot == null || slot.getStart() == null || slot.getType() == null || slot.getSource() == null) {
                    throw new IllegalArgumentException("incomplete slot on " + date);
                }
            }
            if (!list.isEmpty()) {
                slots.put(date, list);
                total += list.size();
            }
        }

        mergeEngine.replaceAll(slots);
        log.info("Restored {} slots over {} dates", total, slots.size());
        long now = clock.millis();
        slots.keySet().forEach(date -> slotChangePublisher.publish(SlotChangedEvent.builder()
                .date(date.toString())
                .changeType(SlotChangedEvent.ChangeType.RESTORED)
                .timestamp(now)
                .build()));
        return new RestoreResultResponse(slots.size(), total);
    }
}
