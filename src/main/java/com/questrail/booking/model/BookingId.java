package com.questrail.booking.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Opaque 128-bit booking identifier minted by the server on a successful book.
 */
public record BookingId(UUID value)
{
    public BookingId {
        Objects.requireNonNull(value, "value");
    }

    public static BookingId random() {
        return new BookingId(UUID.randomUUID());
    }

    public static BookingId parse(String text) {
        return new BookingId(UUID.fromString(text));
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
