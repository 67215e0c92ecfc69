package com.keer.studiosync.schedule.repository;

import com.keer.studiosync.reservation.model.EventSource;
import com.keer.studiosync.schedule.model.Slot;
import com.keer.studiosync.schedule.model.SlotType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessException;
import org.springframework.test.context.TestPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(JpaScheduleStore.class)
@TestPropertySource(properties = "app.schedule.store=jpa")
class JpaScheduleStoreTest {

    private static final LocalDate DATE = LocalDate.of(2025, 11, 2);

    @Autowired
    private JpaScheduleStore store;

    @BeforeEach
    void setUp() {
        store.clear();
    }

    private static Slot slot(int hour, String customer) {
        return Slot.builder()
                .start(LocalTime.of(hour, 0))
                .end(LocalTime.of(hour + 1, 30))
                .type(SlotType.ORDINARY)
                .source(EventSource.EXTERNAL_MAIL)
                .customerName(customer)
                .resource("渋谷店 STUDIO ① (1)")
                .group(1)
                .messageId("msg-" + customer)
                .confidence(0.9)
                .build();
    }

    @Test
    void shouldKeepInsertionOrderWithinDate() {
        store.append(DATE, slot(12, "田中"));
        store.append(DATE, slot(9, "鈴木"));

        List<Slot> slots = store.findByDate(DATE);

        assertEquals(List.of("田中", "鈴木"), slots.stream().map(Slot::getCustomerName).toList());
        assertEquals(slot(12, "田中"), slots.get(0));
    }

    @Test
    void shouldRemoveByPosition() {
        store.append(DATE, slot(10, "田中"));
        store.append(DATE, slot(11, "鈴木"));

        Slot removed = store.removeAt(DATE, 1);

        assertEquals("鈴木", removed.getCustomerName());
        assertEquals(1, store.findByDate(DATE).size());
        assertNull(store.removeAt(DATE, 4));
        assertNull(store.removeAt(DATE.plusDays(1), 0));
    }

    @Test
    void shouldGroupAllSlotsByAscendingDate() {
        store.append(DATE.plusDays(1), slot(10, "翌日"));
        store.append(DATE, slot(10, "当日"));

        SortedMap<LocalDate, List<Slot>> all = store.findAll();

        assertEquals(List.of(DATE, DATE.plusDays(1)), List.copyOf(all.keySet()));
    }

    @Test
    void shouldReplaceAllSlots() {
        store.append(DATE, slot(10, "田中"));

        store.replaceAll(Map.of(DATE.plusDays(1), List.of(slot(9, "鈴木"), slot(11, "佐藤"))));

        assertTrue(store.findByDate(DATE).isEmpty());
        assertEquals(2, store.findByDate(DATE.plusDays(1)).size());
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    void shouldKeepPreviousSlotsWhenReplacementFails() {
        store.append(DATE, slot(10, "田中"));
        Slot tooLong = slot(12, "鈴木").toBuilder().subject("件".repeat(300)).build();

        try {
            assertThrows(DataAccessException.class,
                    () -> store.replaceAll(Map.of(DATE.plusDays(1), List.of(slot(9, "佐藤"), tooLong))));

            assertEquals(List.of("田中"), store.findByDate(DATE).stream().map(Slot::getCustomerName).toList());
            assertTrue(store.findByDate(DATE.plusDays(1)).isEmpty());
        } finally {
            store.clear();
        }
    }
}
