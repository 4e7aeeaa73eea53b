package io.github.sparkify.time;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.IsoFields;
import java.util.Objects;

/**
 * Calendar decomposition of an event timestamp.
 *
 * <p>The timestamp is interpreted as epoch milliseconds and rendered as local time
 * in an explicit zone, so the result never depends on the default zone of the JVM
 * that runs the job. Conventions:
 * <ul>
 *   <li>{@code startTime} is {@code yyyy-MM-dd'T'HH:mm:ss.SSS}, no offset</li>
 *   <li>{@code week} is the ISO-8601 week of the week-based year (1-53)</li>
 *   <li>{@code year} is the calendar year, not the week-based year</li>
 *   <li>{@code weekday} is 0-6 with 0 = Sunday</li>
 * </ul>
 */
public final class TimeParts implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final ZoneId DEFAULT_ZONE = ZoneId.of("UTC");

    public static final DateTimeFormatter START_TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS");

    private final String startTime;
    private final int hour;
    private final int day;
    private final int week;
    private final int month;
    private final int year;
    private final int weekday;

    private TimeParts(String startTime, int hour, int day, int week, int month, int year, int weekday) {
        this.startTime = startTime;
        this.hour = hour;
        this.day = day;
        this.week = week;
        this.month = month;
        this.year = year;
        this.weekday = weekday;
    }

    public static TimeParts of(long epochMillis, ZoneId zone) {
        Objects.requireNonNull(zone, "zone");
        LocalDateTime local = LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMillis), zone);
        return new TimeParts(
                local.format(START_TIME_FORMAT),
                local.getHour(),
                local.getDayOfMonth(),
                local.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR),
                local.getMonthValue(),
                local.getYear(),
                local.getDayOfWeek().getValue() % 7
        );
    }

    public static TimeParts of(long epochMillis) {
        return of(epochMillis, DEFAULT_ZONE);
    }

    public String getStartTime() { return startTime; }
    public int getHour() { return hour; }
    public int getDay() { return day; }
    public int getWeek() { return week; }
    public int getMonth() { return month; }
    public int getYear() { return year; }
    public int getWeekday() { return weekday; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeParts)) return false;
        TimeParts that = (TimeParts) o;
        return hour == that.hour && day == that.day && week == that.week && month == that.month
                && year == that.year && weekday == that.weekday && startTime.equals(that.startTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startTime, hour, day, week, month, year, weekday);
    }

    @Override
    public String toString() {
        return String.format("TimeParts[%s, hour=%d, day=%d, week=%d, month=%d, year=%d, weekday=%d]",
                startTime, hour, day, week, month, year, weekday);
    }
}
