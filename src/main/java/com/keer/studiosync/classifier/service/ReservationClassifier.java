package com.keer.studiosync.classifier.service;

import com.keer.studiosync.classifier.model.ClassifiedReservation;
import com.keer.studiosync.classifier.model.ConfidenceSignals;
import com.keer.studiosync.classifier.model.ExtractedDate;
import com.keer.studiosync.classifier.model.TimeRange;
import com.keer.studiosync.config.ClassifierProperties;
import com.keer.studiosync.reservation.model.ReservationAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides whether a platform notification is a booking or a cancellation for the configured
 * location and pulls out its fields. Stateless between calls; returns {@code null} for anything
 * it cannot classify with a full date and time range.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReservationClassifier {

    private final ClassifierProperties properties;
    private final DateExtractor dateExtractor;
    private final TimeRangeExtractor timeRangeExtractor;
    private final CustomerNameExtractor customerNameExtractor;
    private final StudioExtractor studioExtractor;

    public ClassifiedReservation classify(String subject, String body) {
        String safeSubject = subject == null ? "" : subject;
        String safeBody = body == null ? "" : body;
        String combined = safeSubject + "\n" + safeBody;
        String combinedLower = combined.toLowerCase(Locale.ROOT);

        if (!containsAnyIgnoreCase(combinedLower, properties.brandMarkers())) {
            log.debug("Rejected: no brand marker in '{}'", safeSubject);
            return null;
        }
        if (!acceptsLocation(combinedLower)) {
            log.debug("Rejected: location filter for '{}'", safeSubject);
            return null;
        }

        ReservationAction action = determineAction(combined, combinedLower);
        if (action == null) {
            log.debug("Rejected: no booking or cancellation wording in '{}'", safeSubject);
            return null;
        }

        Optional<ExtractedDate> date = dateExtractor.extract(safeBody);
        Optional<TimeRange> timeRange = timeRangeExtractor.extract(safeBody);
        if (date.isEmpty() || timeRange.isEmpty()) {
            // an action keyword without a full date/time is not worth a guessed booking
            log.debug("Rejected: {} without date or time in '{}'", action, safeSubject);
            return null;
        }

        ConfidenceSignals signals = new ConfidenceSignals(
                action,
                countKeywords(combined, keywordsFor(action)),
                !date.get().yearInferred(),
                !timeRange.get().synthesized(),
                containsAnyLiteral(combined, properties.brandMarkers()));

        return new ClassifiedReservation(
                action,
                date.get().date(),
                timeRange.get(),
                customerNameExtractor.extract(safeBody),
                studioExtractor.extract(safeBody),
                signals.score());
    }

    private boolean acceptsLocation(String combinedLower) {
        if (containsAnyIgnoreCase(combinedLower, properties.excludedLocations())) {
            return false;
        }
        if (containsAnyIgnoreCase(combinedLower, properties.includedLocations())) {
            return true;
        }
        return properties.acceptUnlabeledLocation();
    }

    private ReservationAction determineAction(String combined, String combinedLower) {
        if (countKeywords(combined, properties.cancellationKeywords()) > 0) {
            return ReservationAction.CANCELLATION;
        }
        if (countKeywords(combined, properties.bookingKeywords()) > 0) {
            return ReservationAction.BOOKING;
        }
        if (combined.contains("キャンセル") || combinedLower.contains("cancel")) {
            return ReservationAction.CANCELLATION;
        }
        if (combined.contains("予約") && (combined.contains("ありがとう") || combined.contains("承り"))) {
            return ReservationAction.BOOKING;
        }
        return null;
    }

    private List<String> keywordsFor(ReservationAction action) {
        return action == ReservationAction.CANCELLATION
                ? properties.cancellationKeywords()
                : properties.bookingKeywords();
    }

    private static int countKeywords(String text, List<String> keywords) {
        int hits = 0;
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                hits++;
            }
        }
        return hits;
    }

    private static boolean containsAnyIgnoreCase(String lowerText, List<String> markers) {
        for (String marker : markers) {
            if (lowerText.contains(marker.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAnyLiteral(String text, List<String> markers) {
        for (String marker : markers) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
