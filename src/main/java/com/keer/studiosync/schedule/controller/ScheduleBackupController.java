package com.keer.studiosync.schedule.controller;

import com.keer.studiosync.schedule.dto.RestoreResultResponse;
import com.keer.studiosync.schedule.dto.ScheduleBackup;
import com.keer.studiosync.schedule.service.ScheduleBackupService;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.DateTimeException;
import java.util.Map;

@RestController
@RequestMapping("/api/schedule")
@Profile({"api", "default"})
@RequiredArgsConstructor
public class ScheduleBackupController {

    private final ScheduleBackupService scheduleBackupService;

    @GetMapping("/backup")
    public ResponseEntity<ScheduleBackup> backup() {
        return ResponseEntity.ok(scheduleBackupService.export());
    }

    @PostMapping("/restore")
    public ResponseEntity<RestoreResultResponse> restore(@RequestBody ScheduleBackup backup) {
        return ResponseEntity.ok(scheduleBackupService.restore(backup));
    }

    @ExceptionHandler({IllegalArgumentException.class, DateTimeException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
