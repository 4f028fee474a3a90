package com.questrail.booking.model;

import java.util.Objects;

/**
 * RequestId
 * =============================================================================
 * Identifies one logical invocation: the issuing client plus that client's
 * sequence number.
 *
 * <p>Retransmissions of the same invocation reuse the same identifier; a new
 * invocation always takes the next sequence number. The sequence number is
 * an unsigned 32-bit value on the wire.</p>
 */
public record RequestId(ClientId clientId, long sequence)
{
    public static final long MAX_SEQUENCE = 0xFFFF_FFFFL;

    public RequestId {
        Objects.requireNonNull(clientId, "clientId");
        if (sequence < 0 || sequence > MAX_SEQUENCE) {
            throw new IllegalArgumentException("sequence must fit in 32 unsigned bits (was " + sequence + ")");
        }
    }

    public static RequestId of(ClientId clientId, long sequence) {
        return new RequestId(clientId, sequence);
    }

    @Override
    public String toString() {
        return clientId + "#" + sequence;
    }
}
