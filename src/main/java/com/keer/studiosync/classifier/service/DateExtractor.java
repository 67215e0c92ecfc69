package com.keer.studiosync.classifier.service;

import com.keer.studiosync.classifier.model.ExtractedDate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class DateExtractor {

    // 2025年11月02日, which also covers the labelled "日時：2025年11月02日" line
    private static final Pattern KANJI_DATE = Pattern.compile("(\\d{4})年(\\d{1,2})月(\\d{1,2})日");
    // 2025/11/02, 2025-11-02
    private static final Pattern NUMERIC_DATE = Pattern.compile("(\\d{4})[/-](\\d{1,2})[/-](\\d{1,2})");
    // 11/02, year taken from the clock
    private static final Pattern MONTH_DAY = Pattern.compile("(?<![\\d/])(\\d{1,2})/(\\d{1,2})(?![\\d/])");

    private final Clock clock;
    private final List<TextMatcher<ExtractedDate>> matchers;

    public DateExtractor(Clock clock) {
        this.clock = clock;
        this.matchers = List.of(
                text -> fullDate(KANJI_DATE, text),
                text -> fullDate(NUMERIC_DATE, text),
                this::monthDay
        );
    }

    public Optional<ExtractedDate> extract(String text) {
        return TextMatcher.firstMatch(matchers, text);
    }

    private static Optional<ExtractedDate> fullDate(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        return toDate(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)))
                .map(date -> new ExtractedDate(date, false));
    }

    private Optional<ExtractedDate> monthDay(String text) {
        Matcher m = MONTH_DAY.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        int year = LocalDate.now(clock).getYear();
        return toDate(year, Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)))
                .map(date -> new ExtractedDate(date, true));
    }

    private static Optional<LocalDate> toDate(int year, int month, int day) {
        try {
            return Optional.of(LocalDate.of(year, month, day));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
