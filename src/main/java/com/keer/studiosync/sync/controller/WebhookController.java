package com.keer.studiosync.sync.controller;

import com.keer.studiosync.reservation.dto.WebhookBatchRequest;
import com.keer.studiosync.sync.dto.SyncSummaryResponse;
import com.keer.studiosync.sync.service.SyncService;
import com.keer.studiosync.sync.service.WebhookAuthenticationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.DateTimeException;
import java.util.Map;

@RestController
@Profile({"api", "default"})
@Slf4j
public class WebhookController {

    public static final String SECRET_HEADER = "X-Webhook-Secret";

    private final SyncService syncService;
    private final byte[] secret;

    public WebhookController(SyncService syncService, @Value("${app.webhook.secret:}") String secret) {
        this.syncService = syncService;
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
    }

    @PostMapping("/api/webhook/reservations")
    public ResponseEntity<SyncSummaryResponse> receiveReservations(
            @RequestHeader(value = SECRET_HEADER, required = false) String providedSecret,
            @RequestBody WebhookBatchRequest batch) {
        authenticate(providedSecret);
        return ResponseEntity.ok(syncService.applyWebhook(batch));
    }

    // an unset secret rejects every call
    private void authenticate(String providedSecret) {
        if (secret.length == 0 || providedSecret == null
                || !MessageDigest.isEqual(secret, providedSecret.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected webhook call with missing or wrong secret");
            throw new WebhookAuthenticationException("Unauthorized");
        }
    }

    @ExceptionHandler(WebhookAuthenticationException.class)
    public ResponseEntity<Map<String, String>> handleUnauthorized(WebhookAuthenticationException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, DateTimeException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
