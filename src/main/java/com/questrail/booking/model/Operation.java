package com.questrail.booking.model;

import java.util.Optional;

/**
 * Operation
 * =============================================================================
 * The closed set of services offered by the booking server, with their wire
 * opcode and invocation-semantics classification.
 *
 * <p>Idempotent operations are executed on every delivery (at-least-once).
 * Non-idempotent operations are deduplicated by request id on the server so
 * that their effect is applied at most once.</p>
 */
public enum Operation
{
    QUERY_AVAILABILITY(0x01, true),
    BOOK(0x02, false),
    SHIFT(0x03, false),
    MONITOR(0x04, true),
    LOOKUP_BOOKING(0x05, true),
    CANCEL_BOOKING(0x06, false),
    EXTEND_BOOKING(0x07, false);

    private final int opcode;
    private final boolean idempotent;

    Operation(int opcode, boolean idempotent) {
        this.opcode = opcode;
        this.idempotent = idempotent;
    }

    public int opcode() {
        return opcode;
    }

    public boolean idempotent() {
        return idempotent;
    }

    public static Optional<Operation> fromOpcode(int opcode) {
        for (Operation op : values()) {
            if (op.opcode == opcode) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
