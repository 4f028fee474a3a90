package com.questrail.booking.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>The Netty endpoint delivers callbacks on its single event-loop thread.
 * Listeners that do real work (the server dispatcher) hand the payload off to
 * their own executor instead of blocking that thread.</p>
 */
public interface DatagramEndpointListener
{
    /**
     * Called once the endpoint is bound and usable.
     */
    void onTransportUp();

    /**
     * Called when the endpoint becomes unusable.
     *
     * @param cause failure cause; {@code null} for an orderly stop
     */
    void onTransportDown(Throwable cause);

    /**
     * Called for every received datagram. The payload is a private copy the
     * listener may keep.
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
