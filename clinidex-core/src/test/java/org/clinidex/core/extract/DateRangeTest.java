package org.clinidex.core.extract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.format.DateTimeParseException;

import static org.junit.jupiter.api.Assertions.*;

class DateRangeTest {

    @Test
    void parse_Year_CoversWholeYear() {
        DateRange range = DateRange.parse("2020");

        assertEquals(Instant.parse("2020-01-01T00:00:00Z"), range.start());
        assertEquals(Instant.parse("2021-01-01T00:00:00Z"), range.end());
    }

    @Test
    void parse_YearMonth_CoversMonth() {
        DateRange range = DateRange.parse("2020-02");

        assertEquals(Instant.parse("2020-02-01T00:00:00Z"), range.start());
        assertEquals(Instant.parse("2020-03-01T00:00:00Z"), range.end());
    }

    @Test
    void parse_Date_CoversDay() {
        DateRange range = DateRange.parse("2020-03-05");

        assertEquals(Instant.parse("2020-03-05T00:00:00Z"), range.start());
        assertEquals(Instant.parse("2020-03-06T00:00:00Z"), range.end());
    }

    @Test
    void parse_MinutePrecision_CoversMinute() {
        DateRange range = DateRange.parse("2020-03-05T10:15");

        assertEquals(Instant.parse("2020-03-05T10:15:00Z"), range.start());
        assertEquals(Instant.parse("2020-03-05T10:16:00Z"), range.end());
    }

    @Test
    @DisplayName("Should shift date-times with an offset to UTC")
    void parse_WithOffset_ShiftsToUtc() {
        DateRange range = DateRange.parse("2020-03-05T10:15:30+02:00");

        assertEquals(Instant.parse("2020-03-05T08:15:30Z"), range.start());
        assertEquals(Instant.parse("2020-03-05T08:15:31Z"), range.end());
    }

    @Test
    void parse_Milliseconds_CoversMillisecond() {
        DateRange range = DateRange.parse("2020-03-05T10:15:30.250Z");

        assertEquals(Instant.parse("2020-03-05T10:15:30.250Z"), range.start());
        assertEquals(Instant.parse("2020-03-05T10:15:30.251Z"), range.end());
    }

    @Test
    void parse_Microseconds_CoversMicrosecond() {
        DateRange range = DateRange.parse("2020-03-05T10:15:30.123456Z");

        assertEquals(Instant.parse("2020-03-05T10:15:30.123457Z"), range.end());
    }

    @Test
    void parse_Garbage_Throws() {
        assertThrows(DateTimeParseException.class, () -> DateRange.parse("last tuesday"));
        assertThrows(DateTimeParseException.class, () -> DateRange.parse("2020-13-01"));
    }

    @Test
    void period_OpenEnd_PinnedToHighest() {
        DateRange range = DateRange.period("2020-01-01", null);

        assertEquals(Instant.parse("2020-01-01T00:00:00Z"), range.start());
        assertEquals(DateRange.HIGHEST, range.end());
    }

    @Test
    void period_OpenStart_PinnedToLowest() {
        DateRange range = DateRange.period(null, "2020-01-01");

        assertEquals(DateRange.LOWEST, range.start());
        assertEquals(Instant.parse("2020-01-02T00:00:00Z"), range.end());
    }

    @Test
    void period_EndBeforeStart_Throws() {
        assertThrows(DateTimeParseException.class, () -> DateRange.period("2021-01-01", "2020-01-01"));
    }
}
