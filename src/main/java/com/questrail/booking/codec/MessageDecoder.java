package com.questrail.booking.codec;

import com.questrail.booking.model.WireMessage;

/**
 * MessageDecoder
 * -----------------------------------------------------------------------------
 * Inbound boundary between one received datagram and a semantic
 * {@link WireMessage}.
 *
 * <p>The decoder treats its input as a complete unit. Partial reads and
 * accumulation across datagrams are not supported.</p>
 */
public interface MessageDecoder
{
    /**
     * @param datagram raw datagram payload
     * @return the decoded message
     * @throws MalformedMessageException if the bytes are truncated, carry
     *         unknown tags, out-of-range fields or trailing garbage
     */
    WireMessage decode(byte[] datagram);
}
