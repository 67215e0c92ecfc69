package com.keer.studiosync.classifier.service;

import com.keer.studiosync.reservation.event.ReservationEvent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the customer name in a booking mail. Layers, first hit wins:
 * the line right above the "より、ご予約をいただきました" sentinel, the same layout matched
 * as one regex, honorific and labelled patterns. Falls back to {@link ReservationEvent#UNKNOWN_CUSTOMER}.
 */
@Component
public class CustomerNameExtractor {

    static final int MAX_SENTINEL_NAME_LENGTH = 20;
    static final int MAX_FALLBACK_NAME_LENGTH = 15;

    private static final List<String> SENTINEL_LINES = List.of(
            "より、ご予約をいただきました。",
            "より、ご予約をいただきました");

    private static final Pattern NAME_CHARACTERS = Pattern.compile(
            "^[\\u3040-\\u309F\\u30A0-\\u30FF\\u4E00-\\u9FAF\\u3000-\\u303Fa-zA-Z\\s]+$");

    private static final List<Pattern> SENTINEL_PATTERNS = List.of(
            Pattern.compile("メール\\n\\n([\\u3040-\\u309F\\u30A0-\\u30FF\\u4E00-\\u9FAF\\s]+?)\\n\\nより、ご予約をいただきました"),
            Pattern.compile("メール\\s*\\n\\s*([\\u3040-\\u309F\\u30A0-\\u30FF\\u4E00-\\u9FAF\\s]+?)\\s*\\n\\s*より、ご予約をいただきました"));

    private static final List<Pattern> GENERAL_PATTERNS = List.of(
            Pattern.compile("([^\\s]{1,20})[ \\u3000]?様"),
            Pattern.compile("([^\\s]{1,20})[ \\u3000]?さま"),
            Pattern.compile("([^\\s]{1,20})[ \\u3000]?サマ"),
            Pattern.compile("お名前[：:]\\s*([^\\s]{1,20})"),
            Pattern.compile("氏名[：:]\\s*([^\\s]{1,20})"),
            Pattern.compile("予約者[：:]\\s*([^\\s]{1,20})"));

    private static final List<String> LINE_BLACKLIST = List.of(
            "@", "http", "www", ".com", ".jp", "hallel", "メール", "ご予約");
    private static final List<String> FALLBACK_BLACKLIST = List.of(
            "@", "http", "www", ".com", ".jp", "hallel", "メール", "ご予約", "より");
    private static final List<String> GENERAL_BLACKLIST = List.of("@", "http", "www", ".com", ".jp");
    // "お客様", "皆様" and friends are salutations, not names
    private static final List<String> SALUTATIONS = List.of("お客", "皆", "各位", "会員");

    private static final Pattern HONORIFIC_SUFFIX = Pattern.compile("[ \\u3000]*(様|さま|サマ)$");

    private final List<TextMatcher<String>> matchers = List.of(
            this::lineBeforeSentinel,
            this::sentinelPattern,
            this::generalPattern);

    public String extract(String body) {
        return TextMatcher.firstMatch(matchers, body).orElse(ReservationEvent.UNKNOWN_CUSTOMER);
    }

    private Optional<String> lineBeforeSentinel(String body) {
        String[] lines = body.split("\\r?\\n");
        for (int i = 0; i < lines.length; i++) {
            if (!SENTINEL_LINES.contains(lines[i].strip())) {
                continue;
            }
            for (int j = i - 1; j >= 0; j--) {
                String candidate = lines[j].strip();
                if (candidate.isEmpty()) {
                    continue;
                }
                // only the closest non-empty line is considered
                if (isAcceptableLine(candidate)) {
                    return Optional.of(stripHonorific(candidate));
                }
                break;
            }
        }
        return Optional.empty();
    }

    private Optional<String> sentinelPattern(String body) {
        for (Pattern pattern : SENTINEL_PATTERNS) {
            Matcher m = pattern.matcher(body);
            if (m.find()) {
                String name = stripHonorific(m.group(1).strip());
                if (!name.isEmpty() && name.length() <= MAX_FALLBACK_NAME_LENGTH
                        && !containsAny(name, FALLBACK_BLACKLIST) && !isNumeric(name)) {
                    return Optional.of(name);
                }
            }
        }
        return Optional.empty();
    }

    private Optional<String> generalPattern(String body) {
        for (Pattern pattern : GENERAL_PATTERNS) {
            Matcher m = pattern.matcher(body);
            while (m.find()) {
                String name = stripHonorific(m.group(1).strip());
                if (!name.isEmpty() && !containsAny(name, GENERAL_BLACKLIST) && !isSalutation(name)) {
                    return Optional.of(name);
                }
            }
        }
        return Optional.empty();
    }

    private static boolean isAcceptableLine(String line) {
        return line.length() <= MAX_SENTINEL_NAME_LENGTH
                && !line.endsWith("メール")
                && NAME_CHARACTERS.matcher(line).matches()
                && !containsAny(line, LINE_BLACKLIST)
                && !isNumeric(line);
    }

    private static String stripHonorific(String name) {
        return HONORIFIC_SUFFIX.matcher(name).replaceFirst("").strip();
    }

    private static boolean containsAny(String value, List<String> needles) {
        String lower = value.toLowerCase(Locale.ROOT);
        for (String needle : needles) {
            if (lower.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isSalutation(String name) {
        for (String salutation : SALUTATIONS) {
            if (name.endsWith(salutation)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isNumeric(String value) {
        return value.chars().allMatch(Character::isDigit);
    }
}
