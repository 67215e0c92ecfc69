package com.keer.studiosync.schedule.service;

import com.keer.studiosync.judgment.service.JudgmentLog;
import com.keer.studiosync.reservation.event.ReservationEvent;
import com.keer.studiosync.schedule.dto.SlotResponse;
import com.keer.studiosync.schedule.event.SlotChangedEvent;
import com.keer.studiosync.schedule.model.Slot;
import com.keer.studiosync.schedule.repository.ScheduleStore;
import com.keer.studiosync.schedule.stream.SlotChangePublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleService {

    private final MergeEngine mergeEngine;
    private final ScheduleStore scheduleStore;
    private final JudgmentLog judgmentLog;
    private final SlotChangePublisher slotChangePublisher;
    private final Clock clock;

    public Map<String, List<SlotResponse>> getAllSlots() {
        Map<String, List<SlotResponse>> result = new LinkedHashMap<>();
        scheduleStore.findAll().forEach((date, slots) -> result.put(date.toString(), toResponses(date, slots)));
        return result;
    }

    public List<SlotResponse> getSlots(LocalDate date) {
        return toResponses(date, scheduleStore.findByDate(date));
    }

    public List<SlotResponse> getDetailedSlots() {
        List<SlotResponse> result = new ArrayList<>();
        scheduleStore.findAll().forEach((date, slots) -> result.addAll(toResponses(date, slots)));
        result.sort(Comparator.comparing(SlotResponse::getDate).thenComparing(SlotResponse::getStart));
        return result;
    }

    public MergeOutcome apply(ReservationEvent event) {
        MergeOutcome outcome = mergeEngine.apply(event);
        afterApply(event, outcome);
        return outcome;
    }

    public MergeSummary applyAll(List<ReservationEvent> events) {
        return applyAll(events, (event, outcome) -> {});
    }

    public MergeSummary applyAll(List<ReservationEvent> events, BiConsumer<ReservationEvent, MergeOutcome> onApplied) {
        return mergeEngine.applyAll(events, (event, outcome) -> {
            afterApply(event, outcome);
            onApplied.accept(event, outcome);
        });
    }

    /**
     * Operator deletion by position within the date.
     *
     * @return the removed slot, or {@code null} when nothing is stored at that position
     */
    public SlotResponse remove(LocalDate date, int index) {
        Slot removed = mergeEngine.removeAt(date, index);
        if (removed == null) {
            return null;
        }
        log.info("Removed slot {} of {}: {}-{} {}", index, date, removed.getStart(), removed.getEnd(),
                removed.getCustomerName());
        slotChangePublisher.publish(change(date, SlotChangedEvent.ChangeType.REMOVED, removed.getStart(),
                removed.getEnd(), removed.getCustomerName(), removed.getSource().name()));
        return toResponse(date, index, removed);
    }

    private void afterApply(ReservationEvent event, MergeOutcome outcome) {
        judgmentLog.recordDecision(event, outcome);
        if (!outcome.changedSchedule()) {
            return;
        }
        SlotChangedEvent.ChangeType type = outcome == MergeOutcome.ADDED
                ? SlotChangedEvent.ChangeType.ADDED
                : SlotChangedEvent.ChangeType.CANCELLED;
        slotChangePublisher.publish(change(event.getDate(), type, event.getStart(), event.getEnd(),
                event.getCustomerName(), event.getSource().name()));
    }

    private SlotChangedEvent change(LocalDate date, SlotChangedEvent.ChangeType type, LocalTime start,
                                    LocalTime end, String customerName, String source) {
        return SlotChangedEvent.builder()
                .date(date.toString())
                .changeType(type)
                .start(start.toString())
                .end(end == null ? null : end.toString())
                .customerName(customerName)
                .source(source)
                .timestamp(clock.millis())
                .build();
    }

    private List<SlotResponse> toResponses(LocalDate date, List<Slot> slots) {
        List<SlotResponse> responses = new ArrayList<>(slots.size());
        for (int i = 0; i < slots.size(); i++) {
            responses.add(toResponse(date, i, slots.get(i)));
        }
        return responses;
    }

    private SlotResponse toResponse(LocalDate date, int index, Slot slot) {
        return SlotResponse.builder()
                .date(date.toString())
                .index(index)
                .start(slot.getStart().toString())
                .end(slot.getEnd() == null ? null : slot.getEnd().toString())
                .type(slot.getType().name())
                .typeDisplay(slot.getType().getDisplayName())
                .source(slot.getSource().name())
                .sourceDisplay(slot.getSource().getDisplayName())
                .customerName(slot.getCustomerName())
                .resource(slot.getResource())
                .group(slot.getGroup())
                .sender(slot.getSender())
                .subject(slot.getSubject())
                .messageId(slot.getMessageId())
                .confidence(slot.getConfidence())
                .build();
    }
}
