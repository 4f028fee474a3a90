package com.questrail.booking.model;

import java.util.Objects;

/**
 * A granted booking of one facility.
 *
 * <p>Instances are immutable; shifting or extending a booking replaces the
 * stored record with a copy carrying the new interval.</p>
 */
public record Booking(BookingId id, String facilityName, Interval interval, ClientId owner)
{
    public Booking {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(facilityName, "facilityName");
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(owner, "owner");
    }

    public Booking withInterval(Interval replacement) {
        return new Booking(id, facilityName, replacement, owner);
    }

    public BookedInterval toBookedInterval() {
        return new BookedInterval(id, interval);
    }
}
