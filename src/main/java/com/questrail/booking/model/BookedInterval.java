package com.questrail.booking.model;

import java.util.Objects;

/**
 * One occupied slot as reported by an availability query.
 */
public record BookedInterval(BookingId bookingId, Interval interval)
{
    public BookedInterval {
        Objects.requireNonNull(bookingId, "bookingId");
        Objects.requireNonNull(interval, "interval");
    }
}
