package com.questrail.booking.monitor;

import java.net.SocketAddress;
import java.util.Objects;

/**
 * A client address watching one facility until a monotonic deadline.
 */
public record MonitorSubscription(String facilityName, SocketAddress subscriber, long expiresAtNanos)
{
    public MonitorSubscription {
        Objects.requireNonNull(facilityName, "facilityName");
        Objects.requireNonNull(subscriber, "subscriber");
    }

    /** Live while {@code now < expiry}. */
    public boolean isActiveAt(long nowNanos) {
        return nowNanos - expiresAtNanos < 0;
    }
}
