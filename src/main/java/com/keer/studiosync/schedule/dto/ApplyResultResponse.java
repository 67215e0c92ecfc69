package com.keer.studiosync.schedule.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ApplyResultResponse {

    private String outcome;

    private String action;

    private String date;

    private String start;

    private String end;

    private String customerName;
}
