package com.keer.studiosync.sync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MessageClassificationResponse {

    private boolean classified;

    private String action;

    private String date;

    private String start;

    private String end;

    private String customerName;

    private String studio;

    private Double confidence;

    // null when the message was not merged
    private String outcome;
}
