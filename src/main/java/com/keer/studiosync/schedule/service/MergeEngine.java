package com.keer.studiosync.schedule.service;

import com.keer.studiosync.reservation.event.ReservationEvent;
import com.keer.studiosync.schedule.model.Slot;
import com.keer.studiosync.schedule.repository.ScheduleStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * The only writer of the {@link ScheduleStore}.
 * <p>
 * Every mutation of a date runs under that date's lock, so the duplicate or cancellation scan and the
 * append or removal that follows it are one step for concurrent callers. Date locks are striped: two
 * dates may share a lock, one date never has two. Replacing the whole store takes the exclusive side
 * of a store-wide lock and waits for in-flight merges.
 */
@Service
@Slf4j
public class MergeEngine {

    static final int LOCK_STRIPES = 64;

    private final ScheduleStore store;

    private final ReentrantLock[] dateLocks = new ReentrantLock[LOCK_STRIPES];
    private final ReadWriteLock storeLock = new ReentrantReadWriteLock();

    public MergeEngine(ScheduleStore store) {
        this.store = store;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            dateLocks[i] = new ReentrantLock();
        }
    }

    public MergeOutcome apply(ReservationEvent event) {
        return apply(event, MergePolicy.forSource(event.getSource()));
    }

    public MergeOutcome apply(ReservationEvent event, MergePolicy policy) {
        return withDateLock(event.getDate(), () -> event.isBooking() ? book(event, policy) : cancel(event, policy));
    }

    /**
     * Applies events one by one in the given order. Nothing is rolled back when a later event fails.
     */
    public MergeSummary applyAll(List<ReservationEvent> events, BiConsumer<ReservationEvent, MergeOutcome> onApplied) {
        List<MergeOutcome> outcomes = new ArrayList<>(events.size());
        for (ReservationEvent event : events) {
            MergeOutcome outcome = apply(event);
            outcomes.add(outcome);
            onApplied.accept(event, outcome);
        }
        return MergeSummary.of(outcomes);
    }

    public Slot removeAt(LocalDate date, int index) {
        return withDateLock(date, () -> store.removeAt(date, index));
    }

    public void replaceAll(Map<LocalDate, List<Slot>> slots) {
        storeLock.writeLock().lock();
        try {
            store.replaceAll(slots);
        } finally {
            storeLock.writeLock().unlock();
        }
    }

    private MergeOutcome book(ReservationEvent event, MergePolicy policy) {
        List<Slot> existing = store.findByDate(event.getDate());
        int sameStart = 0;
        for (Slot slot : existing) {
            if (policy.duplicateRule().matches(slot, event)) {
                log.debug("Skipped duplicate {} {} {} ({})",
                        event.getDate(), event.timeRange(), event.getCustomerName(), policy.duplicateRule());
                return MergeOutcome.SKIPPED_DUPLICATE;
            }
            if (slot.getStart().equals(event.getStart())) {
                sameStart++;
            }
        }

        store.append(event.getDate(), toSlot(event, sameStart + 1));
        log.info("Added {} {} {} from {}",
                event.getDate(), event.timeRange(), event.getCustomerName(), event.getSource());
        return MergeOutcome.ADDED;
    }

    private MergeOutcome cancel(ReservationEvent event, MergePolicy policy) {
        List<Slot> existing = store.findByDate(event.getDate());
        for (int i = 0; i < existing.size(); i++) {
            if (policy.cancelRule().matches(existing.get(i), event)) {
                store.removeAt(event.getDate(), i);
                log.info("Cancelled {} {} {} from {}",
                        event.getDate(), event.getStart(), event.getCustomerName(), event.getSource());
                return MergeOutcome.CANCELLED;
            }
        }
        log.info("No slot to cancel for {} {} {}", event.getDate(), event.getStart(), event.getCustomerName());
        return MergeOutcome.CANCEL_NOT_FOUND;
    }

    private <T> T withDateLock(LocalDate date, Supplier<T> action) {
        storeLock.readLock().lock();
        try {
            ReentrantLock lock = lockFor(date);
            lock.lock();
            try {
                return action.get();
            } finally {
                lock.unlock();
            }
        } finally {
            storeLock.readLock().unlock();
        }
    }

    ReentrantLock lockFor(LocalDate date) {
        return dateLocks[Math.floorMod(date.hashCode(), LOCK_STRIPES)];
    }

    private static Slot toSlot(ReservationEvent event, int group) {
        return Slot.builder()
                .start(event.getStart())
                .end(event.getEnd())
                .type(event.getType())
                .source(event.getSource())
                .customerName(event.getCustomerName())
                .resource(event.getResource())
                .group(group)
                .sender(event.getSender())
                .subject(event.getSubject())
                .messageId(event.getMessageId())
                .confidence(event.getConfidence())
                .build();
    }
}
