package com.questrail.booking.codec;

import com.questrail.booking.model.WireMessage;

/**
 * MessageEncoder
 * -----------------------------------------------------------------------------
 * Outbound boundary between semantic {@link WireMessage}s and datagram bytes.
 *
 * <p>The returned array must be suitable for immediate transmission as one
 * datagram. Encoding is deterministic: the same message always yields the
 * same bytes, which is what lets the server replay a cached reply verbatim.</p>
 */
public interface MessageEncoder
{
    /**
     * @throws IllegalArgumentException if the message cannot be represented
     *         on the wire (for example a string longer than 65535 bytes)
     */
    byte[] encode(WireMessage message);
}
