package com.questrail.booking.client;

import com.questrail.booking.internal.time.Cancellable;
import com.questrail.booking.model.Operation;
import com.questrail.booking.model.Reply;
import com.questrail.booking.model.RequestId;

import java.util.concurrent.CompletableFuture;

/**
 * The one outstanding request of a {@link ClientInvocationManager}.
 *
 * <p>Mutable fields are guarded by the manager's lock.</p>
 */
final class PendingInvocation
{
    final RequestId requestId;
    final Operation operation;
    final byte[] datagram;
    final long startedAtNanos;
    final String monitorFacility;
    final MonitorEventListener monitorListener;
    final CompletableFuture<Reply> result = new CompletableFuture<>();

    int attempts;
    int retriesRemaining;
    Cancellable timer;
    long lastRevision = -1;

    PendingInvocation(RequestId requestId,
                      Operation operation,
                      byte[] datagram,
                      long startedAtNanos,
                      int retriesRemaining,
                      String monitorFacility,
                      MonitorEventListener monitorListener)
    {
        this.requestId = requestId;
        this.operation = operation;
        this.datagram = datagram;
        this.startedAtNanos = startedAtNanos;
        this.retriesRemaining = retriesRemaining;
        this.monitorFacility = monitorFacility;
        this.monitorListener = monitorListener;
    }
}
