package com.keer.studiosync.reservation.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WebhookBatchRequest {

    private List<WebhookReservationRequest> reservations;
}
