package org.clinidex.core.extract;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.Year;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A half-open interval {@code [start, end)} covering a date at its written precision.
 * <p>
 * {@code 2020} covers the whole year, {@code 2020-03} the month, {@code 2020-03-05} the
 * day and {@code 2020-03-05T10:15} the minute. Values without an offset are read as UTC.
 * Open ends of a period are pinned to {@link #LOWEST} and {@link #HIGHEST}.
 * </p>
 */
public record DateRange(Instant start, Instant end) {

    public static final Instant LOWEST = Instant.parse("1600-01-01T00:00:00Z");
    public static final Instant HIGHEST = Instant.parse("9999-12-31T00:00:00Z");

    private static final Pattern YEAR = Pattern.compile("^\\d{4}$");
    private static final Pattern YEAR_MONTH = Pattern.compile("^\\d{4}-\\d{2}$");
    private static final Pattern DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern DATE_TIME = Pattern.compile(
            "^(\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2})(:\\d{2})?(\\.\\d+)?(Z|[+-]\\d{2}:\\d{2})?$");

    public DateRange {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new IllegalArgumentException("Invalid date range [" + start + ", " + end + ")");
        }
    }

    /**
     * Parses a date, partial date or date-time.
     *
     * @throws DateTimeParseException if the value is not a recognizable date
     */
    public static DateRange parse(String value) {
        String text = value == null ? "" : value.trim();
        if (YEAR.matcher(text).matches()) {
            Instant start = Year.parse(text).atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
            return new DateRange(start, start.atOffset(ZoneOffset.UTC).plusYears(1).toInstant());
        }
        if (YEAR_MONTH.matcher(text).matches()) {
            Instant start = YearMonth.parse(text).atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
            return new DateRange(start, start.atOffset(ZoneOffset.UTC).plusMonths(1).toInstant());
        }
        if (DATE.matcher(text).matches()) {
            Instant start = LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            return new DateRange(start, start.plus(1, ChronoUnit.DAYS));
        }

        Matcher matcher = DATE_TIME.matcher(text);
        if (matcher.matches()) {
            String offset = matcher.group(4);
            Instant instant = offset != null
                    ? OffsetDateTime.parse(text).toInstant()
                    : LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            instant = instant.truncatedTo(ChronoUnit.MICROS);
            if (matcher.group(2) == null) {
                return new DateRange(instant, instant.plus(1, ChronoUnit.MINUTES));
            }
            if (matcher.group(3) == null) {
                return new DateRange(instant, instant.plus(1, ChronoUnit.SECONDS));
            }
            ChronoUnit unit = matcher.group(3).length() <= 4 ? ChronoUnit.MILLIS : ChronoUnit.MICROS;
            return new DateRange(instant, instant.plus(1, unit));
        }

        throw new DateTimeParseException("Unrecognized date: " + value, text, 0);
    }

    /**
     * Builds the range covered by a period whose ends may each be absent.
     */
    public static DateRange period(String startValue, String endValue) {
        Instant start = startValue != null ? parse(startValue).start() : LOWEST;
        Instant end = endValue != null ? parse(endValue).end() : HIGHEST;
        if (!start.isBefore(end)) {
            throw new DateTimeParseException("Period ends before it starts", startValue + ".." + endValue, 0);
        }
        return new DateRange(start, end);
    }
}
