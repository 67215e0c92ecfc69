package com.keer.studiosync.sync.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AutomationSyncRequest {

    // days after today to fetch; the configured window when absent
    private Integer days;
}
