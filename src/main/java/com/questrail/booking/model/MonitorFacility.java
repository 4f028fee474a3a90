package com.questrail.booking.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Register the calling address for change notifications on a facility for
 * the given observation window.
 */
public record MonitorFacility(String facilityName, Duration window) implements ServiceCall
{
    public MonitorFacility {
        Objects.requireNonNull(facilityName, "facilityName");
        Objects.requireNonNull(window, "window");
        if (window.isNegative() || window.toNanosPart() != 0) {
            throw new IllegalArgumentException("window must be a non-negative number of seconds (was " + window + ")");
        }
    }

    @Override
    public Operation operation() {
        return Operation.MONITOR;
    }
}
