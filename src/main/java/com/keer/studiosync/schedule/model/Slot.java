package com.keer.studiosync.schedule.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.keer.studiosync.reservation.model.EventSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;

/**
 * A merged booking on one date. The date itself is the key it is stored under.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Slot {

    @JsonFormat(pattern = "HH:mm")
    private LocalTime start;

    @JsonFormat(pattern = "HH:mm")
    private LocalTime end;

    private SlotType type;

    private EventSource source;

    private String customerName;

    private String resource;

    // 1-based position among the slots sharing this start time
    private int group;

    private String sender;

    private String subject;

    private String messageId;

    private double confidence;
}
