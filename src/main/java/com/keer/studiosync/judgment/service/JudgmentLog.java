package com.keer.studiosync.judgment.service;

import com.keer.studiosync.judgment.model.JudgmentEntry;
import com.keer.studiosync.judgment.model.JudgmentKind;
import com.keer.studiosync.reservation.event.ReservationEvent;
import com.keer.studiosync.schedule.service.MergeOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Audit trail of classification decisions, kept apart from the schedule itself.
 * Holds the {@value #CAPACITY} most recent entries and drops the oldest first.
 * <p>
 * Export format, one entry per line:
 * {@code yyyy-MM-dd HH:mm:ss | KIND | date | timeRange | customer | confidence | note}, with {@code -} for empty fields.
 * Backslashes and line breaks inside text fields are written as {@code \\}, {@code \r} and {@code \n}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JudgmentLog {

    public static final int CAPACITY = 200;

    static final String SEPARATOR = " | ";
    static final String EMPTY_FIELD = "-";
    private static final int FIELD_COUNT = 7;
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    private final Deque<JudgmentEntry> entries = new ArrayDeque<>();

    public void recordDecision(ReservationEvent event, MergeOutcome outcome) {
        JudgmentKind kind = event.isBooking() ? JudgmentKind.BOOKING : JudgmentKind.CANCELLATION;
        append(new JudgmentEntry(now(), kind, event.getDate(), event.timeRange(), event.getCustomerName(),
                event.getConfidence(), outcome.name() + " via " + event.getSource().getDisplayName()));
    }

    public JudgmentEntry addManual(String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be empty");
        }
        JudgmentEntry entry = annotation(JudgmentKind.MANUAL, message.strip() + " (管理者入力)");
        append(entry);
        return entry;
    }

    /**
     * Empties the log and leaves a single CLEAR entry behind.
     *
     * @return the number of entries removed
     */
    public synchronized int clear() {
        int cleared = entries.size();
        entries.clear();
        entries.addLast(annotation(JudgmentKind.CLEAR, cleared + "件の予約判別ログをクリア (管理者操作)"));
        log.info("Cleared {} judgment log entries", cleared);
        return cleared;
    }

    public synchronized List<JudgmentEntry> entries() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Renders the log as text, then records the export itself. The EXPORT entry is not part of the returned text.
     */
    public synchronized String export() {
        StringJoiner lines = new StringJoiner("\n");
        for (JudgmentEntry entry : entries) {
            lines.add(render(entry));
        }
        append(annotation(JudgmentKind.EXPORT, "予約判別ログをエクスポート (管理者操作)"));
        return lines.toString();
    }

    /**
     * Replaces the log with the entries of a previous export. Blank lines are ignored; if more than
     * {@value #CAPACITY} lines are given only the most recent are kept.
     *
     * @return the number of entries now held
     * @throws IllegalArgumentException when a line is not in export format
     */
    public synchronized int importText(String text) {
        List<JudgmentEntry> parsed = new ArrayList<>();
        String[] lines = text == null ? new String[0] : text.split("\\r?\\n");
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].isBlank()) {
                continue;
            }
            parsed.add(parse(lines[i], i + 1));
        }
        entries.clear();
        parsed.forEach(this::append);
        log.info("Imported {} judgment log entries", entries.size());
        return entries.size();
    }

    private synchronized void append(JudgmentEntry entry) {
        entries.addLast(entry);
        while (entries.size() > CAPACITY) {
            entries.removeFirst();
        }
    }

    private JudgmentEntry annotation(JudgmentKind kind, String note) {
        return new JudgmentEntry(now(), kind, null, null, null, null, note);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock).withNano(0);
    }

    static String render(JudgmentEntry entry) {
        return String.join(SEPARATOR,
                TIMESTAMP.format(entry.timestamp()),
                entry.kind().name(),
                entry.date() == null ? EMPTY_FIELD : entry.date().toString(),
                field(entry.timeRange()),
                field(entry.customerName()),
                entry.confidence() == null ? EMPTY_FIELD : String.format(Locale.ROOT, "%.2f", entry.confidence()),
                entry.note() == null ? EMPTY_FIELD : escape(entry.note()));
    }

    static JudgmentEntry parse(String line, int lineNumber) {
        String[] parts = line.split(" \\| ", FIELD_COUNT);
        if (parts.length != FIELD_COUNT) {
            throw new IllegalArgumentException("line " + lineNumber + ": expected " + FIELD_COUNT + " fields");
        }
        try {
            return new JudgmentEntry(
                    LocalDateTime.parse(parts[0].strip(), TIMESTAMP),
                    JudgmentKind.valueOf(parts[1].strip()),
                    isEmpty(parts[2]) ? null : LocalDate.parse(parts[2].strip()),
                    isEmpty(parts[3]) ? null : unescape(parts[3].strip()),
                    isEmpty(parts[4]) ? null : unescape(parts[4].strip()),
                    isEmpty(parts[5]) ? null : Double.valueOf(parts[5].strip()),
                    isEmpty(parts[6]) ? null : unescape(parts[6]));
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw new IllegalArgumentException("line " + lineNumber + ": " + e.getMessage(), e);
        }
    }

    // '|' inside a field would shift the columns on import
    private static String field(String value) {
        return value == null || value.isBlank() ? EMPTY_FIELD : escape(value.replace('|', '/'));
    }

    // keeps every entry on one line
    static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\r", "\\r").replace("\n", "\\n");
    }

    static String unescape(String value) {
        if (value.indexOf('\\') < 0) {
            return value;
        }
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '\\' || i + 1 == value.length()) {
                out.append(c);
                continue;
            }
            char next = value.charAt(++i);
            if (next == 'n') {
                out.append('\n');
            } else if (next == 'r') {
                out.append('\r');
            } else if (next == '\\') {
                out.append('\\');
            } else {
                out.append(c).append(next);
            }
        }
        return out.toString();
    }

    private static boolean isEmpty(String value) {
        return EMPTY_FIELD.equals(value.strip());
    }
}
