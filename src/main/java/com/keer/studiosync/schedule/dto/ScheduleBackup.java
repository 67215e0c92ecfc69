package com.keer.studiosync.schedule.dto;

import com.keer.studiosync.schedule.model.Slot;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Whole schedule as exported by the backup endpoint; keys are ISO dates.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleBackup {

    private String exportedAt;

    private int totalCount;

    private Map<String, List<Slot>> slots;
}
