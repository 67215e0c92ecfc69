package com.keer.studiosync.classifier.service;

import com.keer.studiosync.classifier.model.TimeRange;
import com.keer.studiosync.config.ClassifierProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
@Slf4j
public class TimeRangeExtractor {

    public static final int SYNTHESIZED_DURATION_MINUTES = 90;

    // 10:00~11:00, 10:00 〜 11:00, 10:00～11:00, 10:00-11:00
    private static final Pattern RANGE = Pattern.compile(
            "(\\d{1,2}):(\\d{2})\\s*[〜～~\\-]\\s*(\\d{1,2}):(\\d{2})");
    private static final Pattern SINGLE = Pattern.compile("(?<!\\d)(\\d{1,2}):(\\d{2})(?!\\d)");

    private final boolean allowCrossMidnight;
    private final List<TextMatcher<TimeRange>> matchers;

    public TimeRangeExtractor(ClassifierProperties properties) {
        this.allowCrossMidnight = properties.allowCrossMidnight();
        this.matchers = List.of(this::range, this::singleStart);
    }

    public Optional<TimeRange> extract(String text) {
        Optional<TimeRange> found = TextMatcher.firstMatch(matchers, text);
        if (found.isPresent() && found.get().crossesMidnight() && !allowCrossMidnight) {
            log.debug("Rejecting time range crossing midnight: {}", found.get());
            return Optional.empty();
        }
        return found;
    }

    /**
     * End time for a message that only states when the booking starts: start plus 1h30m,
     * wrapping past midnight.
     */
    public static LocalTime synthesizeEnd(LocalTime start) {
        return start.plusMinutes(SYNTHESIZED_DURATION_MINUTES);
    }

    private Optional<TimeRange> range(String text) {
        Matcher m = RANGE.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        Optional<LocalTime> start = toTime(m.group(1), m.group(2));
        Optional<LocalTime> end = toTime(m.group(3), m.group(4));
        if (start.isEmpty() || end.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new TimeRange(start.get(), end.get(), false));
    }

    private Optional<TimeRange> singleStart(String text) {
        Matcher m = SINGLE.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        return toTime(m.group(1), m.group(2))
                .map(start -> new TimeRange(start, synthesizeEnd(start), true));
    }

    private static Optional<LocalTime> toTime(String hour, String minute) {
        try {
            return Optional.of(LocalTime.of(Integer.parseInt(hour), Integer.parseInt(minute)));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
