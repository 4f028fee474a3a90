package com.questrail.booking.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Move an existing booking earlier (negative offset) or later (positive
 * offset), keeping its length.
 */
public record ShiftBooking(BookingId bookingId, Duration offset) implements ServiceCall
{
    public ShiftBooking {
        Objects.requireNonNull(bookingId, "bookingId");
        offset = WholeMinutes.require(offset, "offset");
    }

    @Override
    public Operation operation() {
        return Operation.SHIFT;
    }
}
