package com.questrail.booking.model;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Query the booked intervals of a facility for a set of days.
 *
 * <p>An empty day set is representable so the server can reject it with
 * {@link StatusCode#INVALID_REQUEST}.</p>
 */
public record QueryAvailability(String facilityName, Set<DayOfWeek> days) implements ServiceCall
{
    public QueryAvailability {
        Objects.requireNonNull(facilityName, "facilityName");
        Objects.requireNonNull(days, "days");
        days = days.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(days));
    }

    @Override
    public Operation operation() {
        return Operation.QUERY_AVAILABILITY;
    }
}
