package com.keer.studiosync.reservation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One reservation pushed by the mailbox script. Field names follow the script's JSON.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WebhookReservationRequest {

    private String date;

    private String start;

    private String end;

    @JsonProperty("customer_name")
    private String customerName;

    private String type;

    @JsonProperty("is_cancellation")
    private boolean cancellation;

    @JsonProperty("email_id")
    private String messageId;
}
