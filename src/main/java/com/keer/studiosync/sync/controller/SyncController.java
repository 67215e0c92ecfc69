package com.keer.studiosync.sync.controller;

import com.keer.studiosync.sync.dto.AutomationSyncRequest;
import com.keer.studiosync.sync.dto.SyncSummaryResponse;
import com.keer.studiosync.sync.service.SyncFailedException;
import com.keer.studiosync.sync.service.SyncService;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@Profile({"api", "default"})
@RequiredArgsConstructor
public class SyncController {

    private final SyncService syncService;

    @PostMapping("/api/mail/sync")
    public ResponseEntity<SyncSummaryResponse> syncMail() {
        return ResponseEntity.ok(syncService.syncMail());
    }

    @PostMapping("/api/automation/sync")
    public ResponseEntity<SyncSummaryResponse> syncAutomation(@RequestBody(required = false) AutomationSyncRequest request) {
        Integer days = request == null ? null : request.getDays();
        return ResponseEntity.ok(syncService.syncAutomation(days));
    }

    // cause details stay in the server log
    @ExceptionHandler(SyncFailedException.class)
    public ResponseEntity<Map<String, String>> handleSyncFailed(SyncFailedException e) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
