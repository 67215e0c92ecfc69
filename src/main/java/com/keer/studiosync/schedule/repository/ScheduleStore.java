package com.keer.studiosync.schedule.repository;

import com.keer.studiosync.schedule.model.Slot;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Date indexed slots in insertion order. Callers serialize writes per date;
 * implementations only have to keep each single call consistent.
 */
public interface ScheduleStore {

    List<Slot> findByDate(LocalDate date);

    /**
     * Every non-empty date, ascending.
     */
    SortedMap<LocalDate, List<Slot>> findAll();

    void append(LocalDate date, Slot slot);

    /**
     * @return the removed slot, or {@code null} when the date has no slot at {@code index}
     */
    Slot removeAt(LocalDate date, int index);

    void clear();

    /**
     * Swaps the whole content for {@code slots}. Either every slot is stored or the previous content stays.
     */
    void replaceAll(Map<LocalDate, List<Slot>> slots);
}
