package com.keer.studiosync.classifier.service;

import com.keer.studiosync.classifier.model.TimeRange;
import com.keer.studiosync.config.ClassifierProperties;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TimeRangeExtractorTest {

    private final TimeRangeExtractor extractor = new TimeRangeExtractor(ClassifierProperties.defaults());

    @Nested
    class ExplicitRange {

        @Test
        void shouldAcceptEverySeparator() {
            for (String text : new String[]{"10:00~11:00", "10:00 〜 11:00", "10:00～11:00", "10:00-11:00"}) {
                TimeRange range = extractor.extract(text).orElseThrow();
                assertEquals(LocalTime.of(10, 0), range.start(), text);
                assertEquals(LocalTime.of(11, 0), range.end(), text);
                assertFalse(range.synthesized(), text);
            }
        }

        @Test
        void shouldPadSingleDigitHour() {
            TimeRange range = extractor.extract("9:30~10:30").orElseThrow();

            assertEquals(LocalTime.of(9, 30), range.start());
            assertEquals("09:30", range.start().toString());
        }

        @Test
        void shouldRejectInvalidClockValues() {
            assertTrue(extractor.extract("25:00~26:00").isEmpty());
        }
    }

    @Nested
    class SingleStart {

        @Test
        void shouldSynthesizeEndNinetyMinutesLater() {
            TimeRange range = extractor.extract("開始 10:45").orElseThrow();

            assertEquals(LocalTime.of(10, 45), range.start());
            assertEquals(LocalTime.of(12, 15), range.end());
            assertTrue(range.synthesized());
        }

        @Test
        void shouldWrapPastMidnight() {
            assertEquals(LocalTime.of(1, 15), TimeRangeExtractor.synthesizeEnd(LocalTime.of(23, 45)));
        }

        @Test
        void shouldRejectSynthesizedRangeCrossingMidnightByDefault() {
            assertTrue(extractor.extract("開始 23:45").isEmpty());
        }

        @Test
        void shouldKeepCrossMidnightRangeWhenAllowed() {
            ClassifierProperties allowing = new ClassifierProperties(null, null, null, null, null,
                    "渋谷店", 0.7, false, true);
            TimeRangeExtractor lenient = new TimeRangeExtractor(allowing);

            Optional<TimeRange> range = lenient.extract("開始 23:45");

            assertTrue(range.isPresent());
            assertEquals(LocalTime.of(1, 15), range.get().end());
            assertTrue(range.get().crossesMidnight());
        }
    }

    @Test
    void shouldReturnEmptyWithoutTime() {
        assertTrue(extractor.extract("2025年11月02日").isEmpty());
    }
}
