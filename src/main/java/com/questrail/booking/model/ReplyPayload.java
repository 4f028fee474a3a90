package com.questrail.booking.model;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Body of a {@link Reply}. Each successful operation has one payload shape.
 */
public sealed interface ReplyPayload
{
    /** {@link Operation#QUERY_AVAILABILITY}: booked intervals per requested day, in start order. */
    record Availability(Map<DayOfWeek, List<BookedInterval>> days) implements ReplyPayload {
        public Availability {
            Objects.requireNonNull(days, "days");
            EnumMap<DayOfWeek, List<BookedInterval>> copy = new EnumMap<>(DayOfWeek.class);
            days.forEach((day, slots) -> copy.put(day, List.copyOf(slots)));
            days = Collections.unmodifiableMap(copy);
        }
    }

    /** {@link Operation#BOOK}: identifier of the new booking. */
    record Created(BookingId bookingId) implements ReplyPayload {
        public Created {
            Objects.requireNonNull(bookingId, "bookingId");
        }
    }

    /** {@link Operation#SHIFT} and {@link Operation#EXTEND_BOOKING}: the booking's interval after the change. */
    record Rescheduled(Interval interval) implements ReplyPayload {
        public Rescheduled {
            Objects.requireNonNull(interval, "interval");
        }
    }

    /** {@link Operation#MONITOR}: the observation window granted by the server. */
    record Subscribed(Duration window) implements ReplyPayload {
        public Subscribed {
            Objects.requireNonNull(window, "window");
        }
    }

    /** {@link Operation#LOOKUP_BOOKING}: where and when the booking is held. */
    record Details(String facilityName, Interval interval) implements ReplyPayload {
        public Details {
            Objects.requireNonNull(facilityName, "facilityName");
            Objects.requireNonNull(interval, "interval");
        }
    }

    /** {@link Operation#CANCEL_BOOKING}: no body. */
    record Acknowledged() implements ReplyPayload {
    }

    /** Any non-success status. */
    record Failure(String message) implements ReplyPayload {
        public Failure {
            Objects.requireNonNull(message, "message");
        }
    }
}
