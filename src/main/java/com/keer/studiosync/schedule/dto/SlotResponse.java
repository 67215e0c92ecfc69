package com.keer.studiosync.schedule.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SlotResponse {

    private String date;

    private int index;

    private String start;

    private String end;

    private String type;

    private String typeDisplay;

    private String source;

    private String sourceDisplay;

    private String customerName;

    private String resource;

    private int group;

    private String sender;

    private String subject;

    private String messageId;

    private double confidence;
}
