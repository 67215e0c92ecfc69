package com.keer.studiosync.schedule.controller;

import com.keer.studiosync.reservation.dto.ManualReservationRequest;
import com.keer.studiosync.reservation.event.ReservationEvent;
import com.keer.studiosync.reservation.service.ReservationEventNormalizer;
import com.keer.studiosync.schedule.dto.ApplyResultResponse;
import com.keer.studiosync.schedule.dto.DetailedReservationsResponse;
import com.keer.studiosync.schedule.dto.SlotResponse;
import com.keer.studiosync.schedule.service.MergeOutcome;
import com.keer.studiosync.schedule.service.ScheduleService;
import com.keer.studiosync.schedule.service.ScheduleSseService;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@Profile({"api", "default"})
@RequiredArgsConstructor
public class ScheduleController {

    private final ScheduleService scheduleService;
    private final ScheduleSseService scheduleSseService;
    private final ReservationEventNormalizer normalizer;

    @GetMapping("/api/reservations")
    public ResponseEntity<Map<String, List<SlotResponse>>> getAllReservations() {
        return ResponseEntity.ok(scheduleService.getAllSlots());
    }

    @GetMapping("/api/reservations/detailed")
    public ResponseEntity<DetailedReservationsResponse> getDetailedReservations() {
        List<SlotResponse> slots = scheduleService.getDetailedSlots();
        return ResponseEntity.ok(new DetailedReservationsResponse(slots, slots.size()));
    }

    @GetMapping("/api/reservations/{date}")
    public ResponseEntity<List<SlotResponse>> getReservations(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(scheduleService.getSlots(date));
    }

    @PostMapping("/api/reservations")
    public ResponseEntity<ApplyResultResponse> addReservation(@RequestBody ManualReservationRequest request) {
        ReservationEvent event = normalizer.fromManual(request);
        MergeOutcome outcome = scheduleService.apply(event);
        ApplyResultResponse body = ApplyResultResponse.builder()
                .outcome(outcome.name())
                .action(event.getAction().name())
                .date(event.getDate().toString())
                .start(event.getStart().toString())
                .end(event.getEnd() == null ? null : event.getEnd().toString())
                .customerName(event.getCustomerName())
                .build();
        HttpStatus status = outcome == MergeOutcome.ADDED ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(body);
    }

    @DeleteMapping("/api/reservations/{date}/{index}")
    public ResponseEntity<SlotResponse> deleteReservation(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @PathVariable int index) {
        SlotResponse removed = scheduleService.remove(date, index);
        if (removed == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(removed);
    }

    @GetMapping(value = "/api/schedule/{date}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamSlotChanges(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return scheduleSseService.subscribe(date);
    }

    @ExceptionHandler({IllegalArgumentException.class, DateTimeException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
