package com.questrail.booking.model;

/**
 * ServiceCall
 * =============================================================================
 * Semantic body of a request: which service is invoked and with which
 * parameters.
 *
 * <p>The set of calls is closed. Each permitted record maps to exactly one
 * {@link Operation}, which is what the server dispatches on.</p>
 */
public sealed interface ServiceCall
        permits QueryAvailability, BookFacility, ShiftBooking, MonitorFacility,
                LookupBooking, CancelBooking, ExtendBooking
{
    Operation operation();
}
