package com.keer.studiosync.schedule.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DetailedReservationsResponse {

    private List<SlotResponse> reservations;

    private int totalCount;
}
