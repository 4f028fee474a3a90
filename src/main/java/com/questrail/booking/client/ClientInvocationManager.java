package com.questrail.booking.client;

import com.questrail.booking.codec.MalformedMessageException;
import com.questrail.booking.codec.MessageDecoder;
import com.questrail.booking.codec.MessageEncoder;
import com.questrail.booking.internal.time.Cancellable;
import com.questrail.booking.internal.time.MonotonicClock;
import com.questrail.booking.internal.time.MonotonicScheduler;
import com.questrail.booking.model.ClientId;
import com.questrail.booking.model.MonitorEvent;
import com.questrail.booking.model.MonitorFacility;
import com.questrail.booking.model.Operation;
import com.questrail.booking.model.Reply;
import com.questrail.booking.model.ReplyPayload;
import com.questrail.booking.model.Request;
import com.questrail.booking.model.RequestId;
import com.questrail.booking.model.ServiceCall;
import com.questrail.booking.model.WireMessage;
import com.questrail.booking.transport.DatagramEndpoint;
import com.questrail.booking.transport.DatagramEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * ClientInvocationManager
 * =============================================================================
 * Client side of the request/reply protocol: one outstanding invocation at a
 * time, carried over an unreliable datagram endpoint.
 *
 * <h2>Invocation lifecycle</h2>
 * <pre>
 *   Idle --submit--> AwaitingReply --matching reply--> Completed
 *                         |   ^
 *                   timer |   | retransmit identical bytes
 *                         v   |
 *                     (retries left?) --no--> TimedOut
 * </pre>
 * <ul>
 *   <li>Each call takes the next sequence number and is encoded exactly once;
 *       every retransmission resends those bytes, so the server sees the same
 *       {@link RequestId}.</li>
 *   <li>Replies are matched by {@link RequestId}. Late duplicates of earlier
 *       calls are dropped.</li>
 *   <li>After {@link InvocationPolicy#maxRetries()} retransmissions the call
 *       fails with {@link InvocationTimeoutException}.</li>
 * </ul>
 *
 * <h2>Monitoring window</h2>
 * A successful {@code MONITOR} reply opens a window of the granted length
 * during which {@link MonitorEvent}s are passed to the caller's
 * {@link MonitorEventListener} and no other call may be submitted. Pushes
 * duplicated by the network are suppressed by facility revision.
 *
 * <h2>Threading</h2>
 * Inbound datagrams arrive on the transport thread and timers fire on the
 * scheduler thread; both synchronize on one internal lock. Futures complete
 * and listeners run outside that lock.
 */
public final class ClientInvocationManager implements DatagramEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(ClientInvocationManager.class);

    private final ClientId clientId;
    private final SocketAddress server;
    private final DatagramEndpoint endpoint;
    private final MessageEncoder encoder;
    private final MessageDecoder decoder;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final InvocationPolicy policy;

    private final Object lock = new Object();
    private long lastSequence;
    private PendingInvocation pending;
    private MonitoringWindow monitoring;
    private boolean closed;

    public ClientInvocationManager(ClientId clientId,
                                   SocketAddress server,
                                   DatagramEndpoint endpoint,
                                   MessageEncoder encoder,
                                   MessageDecoder decoder,
                                   MonotonicScheduler scheduler,
                                   InvocationPolicy policy)
    {
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.server = Objects.requireNonNull(server, "server");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = scheduler.clock();
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public ClientId clientId()
    {
        return clientId;
    }

    public InvocationPolicy policy()
    {
        return policy;
    }

    // ========================================================================
    // Invocation API
    // ========================================================================

    /**
     * Sends {@code call} and returns a future for its reply. A monitor call
     * submitted this way does not open a monitoring window; use
     * {@link #monitor(MonitorFacility, MonitorEventListener)} for that.
     *
     * <p>The future completes with the server's {@link Reply} (successful or
     * not), or exceptionally with {@link InvocationTimeoutException}. It is
     * cancelled if the manager is closed first.</p>
     *
     * @throws IllegalStateException while another call is outstanding, a
     *         monitoring window is open, or after {@link #close()}
     */
    public CompletableFuture<Reply> submit(ServiceCall call)
    {
        return submit(call, null);
    }

    /**
     * Blocking variant of {@link #submit(ServiceCall)}.
     *
     * @throws InvocationTimeoutException if no reply arrived in time
     * @throws CancellationException      if the manager was closed meanwhile
     */
    public Reply invoke(ServiceCall call) throws InterruptedException
    {
        return await(submit(call));
    }

    /**
     * Sends a monitor request and, once the server confirms it, opens the
     * monitoring window. Events pushed before the confirmation arrives are
     * delivered too.
     */
    public Reply monitor(MonitorFacility call, MonitorEventListener listener) throws InterruptedException
    {
        return await(submitMonitor(call, listener));
    }

    /**
     * Non-blocking variant of {@link #monitor(MonitorFacility, MonitorEventListener)}.
     */
    public CompletableFuture<Reply> submitMonitor(MonitorFacility call, MonitorEventListener listener)
    {
        Objects.requireNonNull(listener, "listener");
        return submit(call, listener);
    }

    /**
     * Blocks until the current monitoring window (if any) has elapsed.
     */
    public void awaitMonitoringEnd() throws InterruptedException
    {
        MonitoringWindow window;
        synchronized (lock) {
            window = monitoring;
        }
        if (window == null) {
            return;
        }
        try {
            window.ended.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("monitoring window ended abnormally", e.getCause());
        }
    }

    public boolean isMonitoring()
    {
        synchronized (lock) {
            return monitoring != null;
        }
    }

    public boolean hasPendingInvocation()
    {
        synchronized (lock) {
            return pending != null;
        }
    }

    /**
     * Cancels the outstanding call and closes any monitoring window. Further
     * submissions are refused.
     */
    public void close()
    {
        PendingInvocation p;
        MonitoringWindow w;
        synchronized (lock) {
            closed = true;
            p = pending;
            w = monitoring;
            pending = null;
            monitoring = null;
            if (p != null && p.timer != null) {
                p.timer.cancel();
            }
            if (w != null) {
                w.timer.cancel();
            }
        }
        if (p != null) {
            p.result.cancel(false);
        }
        if (w != null) {
            w.ended.complete(null);
        }
    }

    private CompletableFuture<Reply> submit(ServiceCall call, MonitorEventListener monitorListener)
    {
        Objects.requireNonNull(call, "call");

        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("invocation manager is closed");
            }
            if (pending != null) {
                throw new IllegalStateException("another call is outstanding: " + pending.requestId);
            }
            if (monitoring != null) {
                throw new IllegalStateException("monitoring " + monitoring.facilityName + " until the window elapses");
            }
            if (lastSequence == RequestId.MAX_SEQUENCE) {
                throw new IllegalStateException("sequence numbers exhausted for client " + clientId);
            }

            RequestId id = RequestId.of(clientId, ++lastSequence);
            byte[] datagram = encoder.encode(new Request(id, call));

            String monitorFacility = call instanceof MonitorFacility m ? m.facilityName() : null;
            PendingInvocation p = new PendingInvocation(id, call.operation(), datagram, clock.nowNanos(),
                    policy.maxRetries(), monitorFacility, monitorListener);
            pending = p;
            transmit(p);
            return p.result;
        }
    }

    // ========================================================================
    // Timers (scheduler thread)
    // ========================================================================

    private void transmit(PendingInvocation p)
    {
        p.attempts++;
        endpoint.send(server, p.datagram);
        p.timer = scheduler.scheduleAfter(policy.timeout(), () -> onTimeout(p));
    }

    private void onTimeout(PendingInvocation p)
    {
        InvocationTimeoutException failure;
        synchronized (lock) {
            if (pending != p) {
                return; // completed meanwhile
            }
            if (p.retriesRemaining > 0) {
                p.retriesRemaining--;
                log.debug("No reply to {} {}; retransmitting (attempt {})", p.operation, p.requestId, p.attempts + 1);
                transmit(p);
                return;
            }
            pending = null;
            failure = new InvocationTimeoutException(p.requestId, p.attempts, clock.elapsedSince(p.startedAtNanos));
        }
        log.warn("{} {} timed out after {} attempts", p.operation, p.requestId, failure.attempts());
        p.result.completeExceptionally(failure);
    }

    private void onWindowElapsed(MonitoringWindow w)
    {
        synchronized (lock) {
            if (monitoring != w) {
                return;
            }
            monitoring = null;
        }
        log.info("Monitoring of {} ended", w.facilityName);
        w.ended.complete(null);
    }

    // ========================================================================
    // Inbound (transport thread)
    // ========================================================================

    @Override
    public void onTransportUp()
    {
        log.info("Client {} transport up", clientId);
    }

    @Override
    public void onTransportDown(Throwable cause)
    {
        if (cause != null) {
            log.warn("Client {} transport failed", clientId, cause);
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload)
    {
        final WireMessage message;
        try {
            message = decoder.decode(payload);
        } catch (MalformedMessageException e) {
            log.warn("Dropping undecodable datagram from {}: {}", remote, e.getMessage());
            return;
        }

        if (message instanceof Reply reply) {
            onReply(reply);
        }
        else if (message instanceof MonitorEvent event) {
            onMonitorEvent(event);
        }
        else {
            log.warn("Ignoring unexpected {} from {}", message.getClass().getSimpleName(), remote);
        }
    }

    private void onReply(Reply reply)
    {
        PendingInvocation p;
        synchronized (lock) {
            p = pending;
            if (p == null || !p.requestId.equals(reply.id())) {
                log.debug("Dropping stale reply for {}", reply.id());
                return;
            }
            pending = null;
            p.timer.cancel();

            if (reply.operation() == Operation.MONITOR && reply.isSuccess() && p.monitorListener != null) {
                Duration window = ((ReplyPayload.Subscribed) reply.payload()).window();
                openWindow(p, window);
            }
        }
        p.result.complete(reply);
    }

    private void openWindow(PendingInvocation p, Duration window)
    {
        MonitoringWindow w = new MonitoringWindow(p.monitorFacility, p.monitorListener);
        w.lastRevision = p.lastRevision;
        w.timer = scheduler.scheduleAfter(window, () -> onWindowElapsed(w));
        monitoring = w;
        log.info("Monitoring {} for {} s", w.facilityName, window.getSeconds());
    }

    private static boolean isStale(MonitorEvent event, long lastRevision)
    {
        if (event.revision() == lastRevision) {
            log.debug("Dropping duplicate event revision {} of {}", event.revision(), event.facilityName());
            return true;
        }
        if (event.revision() < lastRevision) {
            log.debug("Dropping out of order event revision {} of {}; already delivered {}",
                    event.revision(), event.facilityName(), lastRevision);
            return true;
        }
        return false;
    }

    private void onMonitorEvent(MonitorEvent event)
    {
        MonitorEventListener target;
        synchronized (lock) {
            if (monitoring != null) {
                if (isStale(event, monitoring.lastRevision)) {
                    return;
                }
                monitoring.lastRevision = event.revision();
                target = monitoring.listener;
            }
            else if (pending != null && pending.monitorListener != null) {
                if (isStale(event, pending.lastRevision)) {
                    return;
                }
                pending.lastRevision = event.revision();
                target = pending.monitorListener;
            }
            else {
                log.debug("Dropping {} event for {} outside a monitoring window", event.kind(), event.facilityName());
                return;
            }
        }
        target.onEvent(event);
    }

    private static Reply await(CompletableFuture<Reply> future) throws InterruptedException
    {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException(cause);
        }
    }

    private static final class MonitoringWindow
    {
        final String facilityName;
        final MonitorEventListener listener;
        final CompletableFuture<Void> ended = new CompletableFuture<>();
        long lastRevision = -1;
        Cancellable timer;

        MonitoringWindow(String facilityName, MonitorEventListener listener)
        {
            this.facilityName = facilityName;
            this.listener = listener;
        }
    }
}
