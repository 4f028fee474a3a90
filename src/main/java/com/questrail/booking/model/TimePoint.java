package com.questrail.booking.model;

import java.time.DayOfWeek;
import java.util.Objects;

/**
 * TimePoint
 * =============================================================================
 * A single minute within one recurring week.
 *
 * <p>There is no year, date or time zone. The week is modelled as a flat,
 * bounded line running from Monday 00:00 to Sunday 23:59; points are totally
 * ordered by {@link #minuteOfWeek()}.</p>
 *
 * <h2>Wire representation</h2>
 * Three bytes: day index ({@code 0} = Monday .. {@code 6} = Sunday), hour
 * ({@code 0..23}) and minute ({@code 0..59}).
 */
public record TimePoint(DayOfWeek day, int hour, int minute) implements Comparable<TimePoint>
{
    public static final int MINUTES_PER_HOUR = 60;
    public static final int MINUTES_PER_DAY = 24 * MINUTES_PER_HOUR;
    public static final int MINUTES_PER_WEEK = 7 * MINUTES_PER_DAY;

    /** Earliest representable point: Monday 00:00. */
    public static final TimePoint WEEK_START = new TimePoint(DayOfWeek.MONDAY, 0, 0);

    /** Latest representable point: Sunday 23:59. */
    public static final TimePoint WEEK_END = new TimePoint(DayOfWeek.SUNDAY, 23, 59);

    public TimePoint {
        Objects.requireNonNull(day, "day");
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour must be in range 0-23 (was " + hour + ")");
        }
        if (minute < 0 || minute > 59) {
            throw new IllegalArgumentException("minute must be in range 0-59 (was " + minute + ")");
        }
    }

    public static TimePoint of(DayOfWeek day, int hour, int minute) {
        return new TimePoint(day, hour, minute);
    }

    /**
     * Builds the point lying {@code minuteOfWeek} minutes after Monday 00:00.
     *
     * @throws IllegalArgumentException if the value falls outside the week
     */
    public static TimePoint ofMinuteOfWeek(int minuteOfWeek) {
        if (!isRepresentable(minuteOfWeek)) {
            throw new IllegalArgumentException("minute of week out of range: " + minuteOfWeek);
        }
        int dayIndex = minuteOfWeek / MINUTES_PER_DAY;
        int minuteOfDay = minuteOfWeek % MINUTES_PER_DAY;
        return new TimePoint(dayOfIndex(dayIndex), minuteOfDay / MINUTES_PER_HOUR, minuteOfDay % MINUTES_PER_HOUR);
    }

    public static boolean isRepresentable(long minuteOfWeek) {
        return minuteOfWeek >= 0 && minuteOfWeek < MINUTES_PER_WEEK;
    }

    /**
     * Maps a wire day index ({@code 0} = Monday) onto {@link DayOfWeek}.
     */
    public static DayOfWeek dayOfIndex(int index) {
        if (index < 0 || index > 6) {
            throw new IllegalArgumentException("day index must be in range 0-6 (was " + index + ")");
        }
        return DayOfWeek.of(index + 1);
    }

    public static int indexOf(DayOfWeek day) {
        return day.getValue() - 1;
    }

    public int dayIndex() {
        return indexOf(day);
    }

    public int minuteOfWeek() {
        return dayIndex() * MINUTES_PER_DAY + hour * MINUTES_PER_HOUR + minute;
    }

    public boolean isBefore(TimePoint other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(TimePoint o) {
        return Integer.compare(minuteOfWeek(), o.minuteOfWeek());
    }

    @Override
    public String toString() {
        String name = day.name();
        return name.charAt(0) + name.substring(1, 3).toLowerCase() + String.format(" %02d:%02d", hour, minute);
    }
}
