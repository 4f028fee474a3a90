package com.questrail.booking.model;

import java.util.Objects;

/**
 * Read the facility and interval of an existing booking.
 */
public record LookupBooking(BookingId bookingId) implements ServiceCall
{
    public LookupBooking {
        Objects.requireNonNull(bookingId, "bookingId");
    }

    @Override
    public Operation operation() {
        return Operation.LOOKUP_BOOKING;
    }
}
