package com.questrail.booking.model;

import java.util.Optional;

/**
 * Kind of facility change reported to monitoring clients.
 */
public enum MutationKind
{
    BOOKED(1),
    SHIFTED(2),
    EXTENDED(3),
    CANCELLED(4);

    private final int code;

    MutationKind(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<MutationKind> fromCode(int code) {
        for (MutationKind kind : values()) {
            if (kind.code == code) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
