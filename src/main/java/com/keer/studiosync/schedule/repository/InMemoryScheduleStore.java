package com.keer.studiosync.schedule.repository;

import com.keer.studiosync.schedule.model.Slot;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
@ConditionalOnProperty(name = "app.schedule.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryScheduleStore implements ScheduleStore {

    private final ConcurrentHashMap<LocalDate, CopyOnWriteArrayList<Slot>> slots = new ConcurrentHashMap<>();

    @Override
    public List<Slot> findByDate(LocalDate date) {
        CopyOnWriteArrayList<Slot> list = slots.get(date);
        return list == null ? List.of() : List.copyOf(list);
    }

    @Override
    public SortedMap<LocalDate, List<Slot>> findAll() {
        SortedMap<LocalDate, List<Slot>> result = new TreeMap<>();
        slots.forEach((date, list) -> {
            if (!list.isEmpty()) {
                result.put(date, List.copyOf(list));
            }
        });
        return result;
    }

    @Override
    public void append(LocalDate date, Slot slot) {
        slots.computeIfAbsent(date, k -> new CopyOnWriteArrayList<>()).add(slot);
    }

    @Override
    public Slot removeAt(LocalDate date, int index) {
        CopyOnWriteArrayList<Slot> list = slots.get(date);
        if (list == null || index < 0 || index >= list.size()) {
            return null;
        }
        return list.remove(index);
    }

    @Override
    public void clear() {
        slots.clear();
    }

    @Override
    public void replaceAll(Map<LocalDate, List<Slot>> replacement) {
        Map<LocalDate, CopyOnWriteArrayList<Slot>> copy = new TreeMap<>();
        replacement.forEach((date, list) -> copy.put(date, new CopyOnWriteArrayList<>(list)));
        slots.clear();
        slots.putAll(copy);
    }
}
