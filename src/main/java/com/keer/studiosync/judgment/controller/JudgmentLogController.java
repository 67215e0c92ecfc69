package com.keer.studiosync.judgment.controller;

import com.keer.studiosync.judgment.dto.ManualLogRequest;
import com.keer.studiosync.judgment.model.JudgmentEntry;
import com.keer.studiosync.judgment.service.JudgmentLog;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/logs")
@Profile({"api", "default"})
@RequiredArgsConstructor
public class JudgmentLogController {

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final JudgmentLog judgmentLog;
    private final Clock clock;

    @GetMapping
    public ResponseEntity<Map<String, Object>> getLogs() {
        List<JudgmentEntry> entries = judgmentLog.entries();
        return ResponseEntity.ok(Map.of("logs", entries, "count", entries.size()));
    }

    @PostMapping
    public ResponseEntity<JudgmentEntry> addLog(@RequestBody ManualLogRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(judgmentLog.addManual(request.getMessage()));
    }

    @PostMapping("/clear")
    public ResponseEntity<Map<String, Integer>> clearLogs() {
        return ResponseEntity.ok(Map.of("clearedCount", judgmentLog.clear()));
    }

    @GetMapping(value = "/export", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> exportLogs() {
        String filename = "reservation_judgment_logs_" + FILE_STAMP.format(LocalDateTime.now(clock)) + ".txt";
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + filename)
                .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                .body(judgmentLog.export());
    }

    @PostMapping(value = "/import", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<Map<String, Integer>> importLogs(@RequestBody String text) {
        return ResponseEntity.ok(Map.of("count", judgmentLog.importText(text)));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
