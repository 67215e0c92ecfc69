package com.keer.studiosync.schedule.repository;

import com.keer.studiosync.schedule.model.SlotEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface SlotRepository extends JpaRepository<SlotEntity, Long> {

    List<SlotEntity> findByDateOrderByIdAsc(LocalDate date);

    List<SlotEntity> findAllByOrderByDateAscIdAsc();
}
