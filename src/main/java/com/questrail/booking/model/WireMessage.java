package com.questrail.booking.model;

/**
 * WireMessage
 * =============================================================================
 * Anything that travels in a single datagram between client and server.
 *
 * <ul>
 *   <li>{@link Request}: client to server, one invocation attempt</li>
 *   <li>{@link Reply}: server to client, answer to a request id</li>
 *   <li>{@link MonitorEvent}: server to client, unsolicited change push</li>
 * </ul>
 *
 * <p>These are semantic messages only. Byte layout lives in the codec.</p>
 */
public sealed interface WireMessage permits Request, Reply, MonitorEvent
{
}
