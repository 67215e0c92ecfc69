package com.keer.studiosync.classifier.service;

import com.keer.studiosync.config.ClassifierProperties;
import com.keer.studiosync.reservation.event.ReservationEvent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class StudioExtractor {

    private static final String BARE_STUDIO = "STUDIO";

    private final List<TextMatcher<String>> matchers;

    public StudioExtractor(ClassifierProperties properties) {
        // "渋谷店 STUDIO ⑥ (1)"
        Pattern labelled = Pattern.compile(
                "(" + Pattern.quote(properties.studioLocation()) + "\\s*STUDIO\\s*[①-⑩]*\\s*\\(\\d+\\))");
        this.matchers = List.of(
                text -> {
                    Matcher m = labelled.matcher(text);
                    return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
                },
                text -> text.contains(BARE_STUDIO) ? Optional.of(BARE_STUDIO) : Optional.empty()
        );
    }

    public String extract(String body) {
        return TextMatcher.firstMatch(matchers, body).orElse(ReservationEvent.UNKNOWN_RESOURCE);
    }
}
