package com.questrail.booking.model;

import java.util.Optional;

/**
 * Reply status carried in every reply datagram.
 */
public enum StatusCode
{
    SUCCESS(0),
    MALFORMED_REQUEST(1),
    FACILITY_NOT_FOUND(2),
    BOOKING_NOT_FOUND(3),
    INVALID_INTERVAL(4),
    OVERLAP(5),
    INVALID_REQUEST(6);

    private final int code;

    StatusCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }

    public static Optional<StatusCode> fromCode(int code) {
        for (StatusCode status : values()) {
            if (status.code == code) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
