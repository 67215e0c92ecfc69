package com.keer.studiosync.sync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncSummaryResponse {

    private String source;

    private int fetched;

    private int accepted;

    private int added;

    private int cancelled;

    private int skipped;

    private int notFound;
}
