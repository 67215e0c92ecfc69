package com.keer.studiosync.schedule.repository;

import com.keer.studiosync.schedule.model.Slot;
import com.keer.studiosync.schedule.model.SlotEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Relational backend. Insertion order is the generated id order.
 */
@Repository
@ConditionalOnProperty(name = "app.schedule.store", havingValue = "jpa")
@RequiredArgsConstructor
public class JpaScheduleStore implements ScheduleStore {

    private final SlotRepository slotRepository;

    @Override
    @Transactional(readOnly = true)
    public List<Slot> findByDate(LocalDate date) {
        return slotRepository.findByDateOrderByIdAsc(date).stream()
                .map(SlotEntity::toSlot)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public SortedMap<LocalDate, List<Slot>> findAll() {
        SortedMap<LocalDate, List<Slot>> result = new TreeMap<>();
        for (SlotEntity entity : slotRepository.findAllByOrderByDateAscIdAsc()) {
            result.computeIfAbsent(entity.getDate(), k -> new ArrayList<>()).add(entity.toSlot());
        }
        return result;
    }

    @Override
    @Transactional
    public void append(LocalDate date, Slot slot) {
        slotRepository.save(SlotEntity.from(date, slot));
    }

    @Override
    @Transactional
    public Slot removeAt(LocalDate date, int index) {
        List<SlotEntity> entities = slotRepository.findByDateOrderByIdAsc(date);
        if (index < 0 || index >= entities.size()) {
            return null;
        }
        SlotEntity removed = entities.get(index);
        slotRepository.delete(removed);
        return removed.toSlot();
    }

    @Override
    @Transactional
    public void clear() {
        slotRepository.deleteAllInBatch();
    }

    @Override
    @Transactional
    public void replaceAll(Map<LocalDate, List<Slot>> slots) {
        slotRepository.deleteAllInBatch();
        List<SlotEntity> entities = new ArrayList<>();
        slots.forEach((date, list) -> list.forEach(slot -> entities.add(SlotEntity.from(date, slot))));
        slotRepository.saveAllAndFlush(entities);
    }
}
