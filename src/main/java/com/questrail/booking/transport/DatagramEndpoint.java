package com.questrail.booking.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a connectionless datagram transport.
 *
 * <p>The endpoint moves whole datagrams and nothing else: it never decodes,
 * retries or deduplicates. Those concerns belong to the invocation managers on
 * either side.</p>
 *
 * <p>Implementations: {@code NettyUdpDatagramEndpoint} (production),
 * {@code LossyDatagramEndpoint} (decorator simulating an unreliable network),
 * and a recording fake in tests.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint and begin receiving datagrams.
     *
     * <p>On successful activation the listener is notified via
     * {@link DatagramEndpointListener#onTransportUp()}.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     */
    void stop();

    /**
     * Send one datagram, fire-and-forget. Delivery is not guaranteed.
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Register the listener that receives inbound datagrams and lifecycle
     * events. Must be called before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);
}
