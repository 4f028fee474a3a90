package com.questrail.booking.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Move only the end of an existing booking by a signed offset.
 */
public record ExtendBooking(BookingId bookingId, Duration offset) implements ServiceCall
{
    public ExtendBooking {
        Objects.requireNonNull(bookingId, "bookingId");
        offset = WholeMinutes.require(offset, "offset");
    }

    @Override
    public Operation operation() {
        return Operation.EXTEND_BOOKING;
    }
}
