package com.questrail.booking.model;

import java.util.Objects;

/**
 * A request was executed (or validated) and refused for a domain reason.
 *
 * <p>On the server this is translated into a reply carrying {@link #status()};
 * on the client a non-success reply is raised to the caller as this same
 * exception. It is never fatal to either process.</p>
 */
public final class BookingRejectedException extends RuntimeException
{
    private final StatusCode status;

    public BookingRejectedException(StatusCode status, String message) {
        super(message);
        this.status = Objects.requireNonNull(status, "status");
        if (status.isSuccess()) {
            throw new IllegalArgumentException("a rejection cannot carry SUCCESS");
        }
    }

    public StatusCode status() {
        return status;
    }
}
