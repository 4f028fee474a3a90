package com.questrail.booking.model;

import java.util.Objects;

/**
 * Change notification pushed to monitoring clients.
 *
 * <p>{@code interval} is the booking's interval after the mutation, or the
 * released interval for {@link MutationKind#CANCELLED}. {@code revision} is the
 * facility's mutation counter; events of one facility are pushed in strictly
 * increasing revision order.</p>
 */
public record MonitorEvent(String facilityName,
                           MutationKind kind,
                           BookingId bookingId,
                           Interval interval,
                           long revision) implements WireMessage
{
    public MonitorEvent {
        Objects.requireNonNull(facilityName, "facilityName");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(bookingId, "bookingId");
        Objects.requireNonNull(interval, "interval");
        if (revision < 0 || revision > RequestId.MAX_SEQUENCE) {
            throw new IllegalArgumentException("revision must fit in 32 unsigned bits (was " + revision + ")");
        }
    }
}
