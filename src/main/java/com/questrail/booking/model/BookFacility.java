package com.questrail.booking.model;

import java.util.Objects;

/**
 * Book a facility for {@code [start, end)}.
 *
 * <p>The bounds are carried unvalidated; ordering is checked by the booking
 * engine so that a reversed range is reported as
 * {@link StatusCode#INVALID_INTERVAL} rather than a malformed request.</p>
 */
public record BookFacility(String facilityName, TimePoint start, TimePoint end) implements ServiceCall
{
    public BookFacility {
        Objects.requireNonNull(facilityName, "facilityName");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    @Override
    public Operation operation() {
        return Operation.BOOK;
    }
}
