package com.keer.studiosync.reservation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ManualReservationRequest {

    private String date;

    private String start;

    private String end;

    private String customerName;

    private String type;

    private boolean cancellation;
}
