package com.keer.studiosync.schedule.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SlotChangedEvent {

    public enum ChangeType { ADDED, CANCELLED, REMOVED, RESTORED }

    private String date;
    private ChangeType changeType;
    private String start;
    private String end;
    private String customerName;
    private String source;
    private Long timestamp;
}
