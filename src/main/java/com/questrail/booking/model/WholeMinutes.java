package com.questrail.booking.model;

import java.time.Duration;
import java.util.Objects;

final class WholeMinutes
{
    private WholeMinutes() {
    }

    /**
     * Offsets travel as signed 32-bit minute counts.
     */
    static Duration require(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.toSecondsPart() != 0 || value.toNanosPart() != 0) {
            throw new IllegalArgumentException(name + " must be a whole number of minutes (was " + value + ")");
        }
        long minutes = value.toMinutes();
        if (minutes < Integer.MIN_VALUE || minutes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(name + " does not fit the wire format: " + value);
        }
        return value;
    }
}
