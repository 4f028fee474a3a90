package com.questrail.booking.model;

import java.util.Objects;

/**
 * Release an existing booking.
 */
public record CancelBooking(BookingId bookingId) implements ServiceCall
{
    public CancelBooking {
        Objects.requireNonNull(bookingId, "bookingId");
    }

    @Override
    public Operation operation() {
        return Operation.CANCEL_BOOKING;
    }
}
