package com.keer.studiosync.schedule.service;

import com.keer.studiosync.schedule.event.SlotChangedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live views of one date's schedule. Each subscriber gets a {@code subscribed} event right away and
 * a {@code slot-change} event for every change to that date afterwards.
 */
@Service
@Profile({"api", "default"})
@Slf4j
public class ScheduleSseService {

    static final String SUBSCRIBED_EVENT = "subscribed";
    static final String SLOT_CHANGE_EVENT = "slot-change";

    private final Map<LocalDate, Set<SseEmitter>> subscribers = new ConcurrentHashMap<>();
    private final long timeoutMillis;

    public ScheduleSseService(@Value("${app.sse.timeout-ms:0}") long timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
    }

    public SseEmitter subscribe(LocalDate date) {
        // 0 keeps the stream open until the client goes away
        SseEmitter emitter = new SseEmitter(timeoutMillis);
        subscribers.computeIfAbsent(date, d -> ConcurrentHashMap.newKeySet()).add(emitter);

        emitter.onCompletion(() -> unsubscribe(date, emitter));
        emitter.onTimeout(() -> unsubscribe(date, emitter));
        emitter.onError(e -> unsubscribe(date, emitter));

        try {
            emitter.send(SseEmitter.event().name(SUBSCRIBED_EVENT).data(date.toString()));
        } catch (IOException e) {
            unsubscribe(date, emitter);
            emitter.completeWithError(e);
        }
        return emitter;
    }

    public int subscriberCount(LocalDate date) {
        Set<SseEmitter> emitters = subscribers.get(date);
        return emitters == null ? 0 : emitters.size();
    }

    public void broadcast(LocalDate date, SlotChangedEvent change) {
        Set<SseEmitter> emitters = subscribers.get(date);
        if (emitters == null) {
            return;
        }

        List<SseEmitter> gone = new ArrayList<>();
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(slotChange(change));
            } catch (IOException e) {
                log.debug("Dropping SSE subscriber for {}: {}", date, e.getMessage());
                gone.add(emitter);
                emitter.completeWithError(e);
            }
        }
        gone.forEach(emitter -> unsubscribe(date, emitter));
    }

    private static SseEmitter.SseEventBuilder slotChange(SlotChangedEvent change) {
        SseEmitter.SseEventBuilder event = SseEmitter.event().name(SLOT_CHANGE_EVENT).data(change);
        if (change.getTimestamp() != null) {
            event.id(String.valueOf(change.getTimestamp()));
        }
        return event;
    }

    private void unsubscribe(LocalDate date, SseEmitter emitter) {
        subscribers.computeIfPresent(date, (d, emitters) -> {
            emitters.remove(emitter);
            return emitters.isEmpty() ? null : emitters;
        });
    }
}
