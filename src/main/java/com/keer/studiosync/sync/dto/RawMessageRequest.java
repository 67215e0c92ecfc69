package com.keer.studiosync.sync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RawMessageRequest {

    private String subject;

    private String body;

    private String messageId;

    private String sender;
}
