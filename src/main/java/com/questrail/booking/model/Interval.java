package com.questrail.booking.model;

import java.time.DayOfWeek;
import java.util.Objects;
import java.util.Optional;

/**
 * Half-open booked interval {@code [start, end)} within one week.
 *
 * <p>The start is always strictly before the end; wraparound past Sunday
 * 23:59 is not representable. An interval may span several days.</p>
 */
public record Interval(TimePoint start, TimePoint end)
{
    public Interval {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("interval start " + start + " must be before end " + end);
        }
    }

    public static Interval of(TimePoint start, TimePoint end) {
        return new Interval(start, end);
    }

    /**
     * Builds an interval from raw minute-of-week bounds, or nothing when the
     * bounds are out of the week or not strictly ordered.
     */
    public static Optional<Interval> ofMinutes(long startMinute, long endMinute) {
        if (!TimePoint.isRepresentable(startMinute) || !TimePoint.isRepresentable(endMinute)) {
            return Optional.empty();
        }
        if (startMinute >= endMinute) {
            return Optional.empty();
        }
        return Optional.of(new Interval(
                TimePoint.ofMinuteOfWeek((int) startMinute),
                TimePoint.ofMinuteOfWeek((int) endMinute)));
    }

    /**
     * Half-open overlap test: {@code s1 < e2 && s2 < e1}. Touching intervals
     * do not overlap.
     */
    public boolean overlaps(Interval other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public boolean intersects(DayOfWeek day) {
        int dayStart = TimePoint.indexOf(day) * TimePoint.MINUTES_PER_DAY;
        int dayEnd = dayStart + TimePoint.MINUTES_PER_DAY;
        return start.minuteOfWeek() < dayEnd && dayStart < end.minuteOfWeek();
    }

    public int lengthMinutes() {
        return end.minuteOfWeek() - start.minuteOfWeek();
    }

    @Override
    public String toString() {
        return start + " - " + end;
    }
}
