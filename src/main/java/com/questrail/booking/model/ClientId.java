package com.questrail.booking.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of one client instance. Together with the per-client sequence
 * number it forms the server's duplicate-suppression key.
 */
public record ClientId(UUID value)
{
    public ClientId {
        Objects.requireNonNull(value, "value");
    }

    public static ClientId random() {
        return new ClientId(UUID.randomUUID());
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
