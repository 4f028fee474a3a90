package com.questrail.booking.server;

import com.questrail.booking.codec.MalformedMessageException;
import com.questrail.booking.codec.MessageDecoder;
import com.questrail.booking.codec.MessageEncoder;
import com.questrail.booking.facility.BookingEngine;
import com.questrail.booking.model.BookFacility;
import com.questrail.booking.model.Booking;
import com.questrail.booking.model.BookingRejectedException;
import com.questrail.booking.model.CancelBooking;
import com.questrail.booking.model.ExtendBooking;
import com.questrail.booking.model.LookupBooking;
import com.questrail.booking.model.MonitorFacility;
import com.questrail.booking.model.QueryAvailability;
import com.questrail.booking.model.Reply;
import com.questrail.booking.model.ReplyPayload;
import com.questrail.booking.model.Request;
import com.questrail.booking.model.ServiceCall;
import com.questrail.booking.model.ShiftBooking;
import com.questrail.booking.model.StatusCode;
import com.questrail.booking.model.WireMessage;
import com.questrail.booking.monitor.MonitorRegistry;
import com.questrail.booking.transport.DatagramEndpoint;
import com.questrail.booking.transport.DatagramEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * RequestDispatcher
 * =============================================================================
 * Server-side invocation manager: turns each inbound datagram into at most one
 * reply datagram.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>Hand the datagram from the receiving thread to the worker executor.</li>
 *   <li>Decode. A malformed request whose header was readable is answered
 *       with {@link StatusCode#MALFORMED_REQUEST}; anything else unreadable is
 *       dropped.</li>
 *   <li>Idempotent operations execute on every delivery. Non-idempotent
 *       operations go through the {@link ReplyCache}, so a retransmission is
 *       answered with the recorded reply bytes.</li>
 *   <li>Encode the outcome, successful or rejected, and send it to the
 *       datagram's source address.</li>
 * </ol>
 *
 * <p>An unexpected failure while handling one datagram is logged and produces
 * no reply; the client's retransmission gets another chance.</p>
 */
public final class RequestDispatcher implements DatagramEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

    private final BookingEngine engine;
    private final MonitorRegistry monitors;
    private final DatagramEndpoint endpoint;
    private final MessageDecoder decoder;
    private final MessageEncoder encoder;
    private final ReplyCache replyCache;
    private final Executor workers;

    public RequestDispatcher(BookingEngine engine,
                             MonitorRegistry monitors,
                             DatagramEndpoint endpoint,
                             MessageDecoder decoder,
                             MessageEncoder encoder,
                             ReplyCache replyCache,
                             Executor workers)
    {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.monitors = Objects.requireNonNull(monitors, "monitors");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.replyCache = Objects.requireNonNull(replyCache, "replyCache");
        this.workers = Objects.requireNonNull(workers, "workers");
    }

    @Override
    public void onTransportUp()
    {
        log.info("Booking server accepting requests");
    }

    @Override
    public void onTransportDown(Throwable cause)
    {
        if (cause == null) {
            log.info("Booking server transport closed");
        }
        else {
            log.warn("Booking server transport failed", cause);
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload)
    {
        try {
            workers.execute(() -> handle(remote, payload));
        } catch (RejectedExecutionException e) {
            log.debug("Worker pool shut down; discarding datagram from {}", remote);
        }
    }

    /**
     * Processes one datagram on the calling thread.
     */
    void handle(SocketAddress remote, byte[] payload)
    {
        try {
            final WireMessage message;
            try {
                message = decoder.decode(payload);
            } catch (MalformedMessageException e) {
                rejectMalformed(remote, e);
                return;
            }

            if (!(message instanceof Request request)) {
                log.warn("Ignoring non-request message {} from {}", message.getClass().getSimpleName(), remote);
                return;
            }

            final byte[] reply;
            if (request.operation().idempotent()) {
                reply = execute(request, remote);
            }
            else {
                ReplyCache.Resolution resolution = replyCache.resolve(request.id(), () -> execute(request, remote));
                if (resolution.replayed()) {
                    log.debug("Duplicate {} {} from {}; resending recorded reply",
                            request.operation(), request.id(), remote);
                }
                reply = resolution.reply();
            }
            endpoint.send(remote, reply);
        } catch (RuntimeException e) {
            log.error("Failed to handle datagram from {}", remote, e);
        }
    }

    private void rejectMalformed(SocketAddress remote, MalformedMessageException e)
    {
        if (e.requestId().isEmpty() || e.operation().isEmpty()) {
            log.warn("Dropping undecodable datagram from {}: {}", remote, e.getMessage());
            return;
        }
        log.warn("Malformed {} {} from {}: {}", e.operation().get(), e.requestId().get(), remote, e.getMessage());
        Reply reply = Reply.failure(e.requestId().get(), e.operation().get(),
                StatusCode.MALFORMED_REQUEST, e.getMessage());
        endpoint.send(remote, encoder.encode(reply));
    }

    private byte[] execute(Request request, SocketAddress remote)
    {
        Reply reply;
        try {
            reply = Reply.success(request.id(), request.operation(), dispatch(request, remote));
        } catch (BookingRejectedException e) {
            log.debug("{} {} rejected: {} {}", request.operation(), request.id(), e.status(), e.getMessage());
            reply = Reply.failure(request.id(), request.operation(), e.status(), e.getMessage());
        }
        return encoder.encode(reply);
    }

    private ReplyPayload dispatch(Request request, SocketAddress remote)
    {
        ServiceCall call = request.call();
        return switch (call.operation()) {
            case QUERY_AVAILABILITY -> {
                QueryAvailability query = (QueryAvailability) call;
                yield new ReplyPayload.Availability(engine.queryAvailability(query.facilityName(), query.days()));
            }
            case BOOK -> {
                BookFacility book = (BookFacility) call;
                Booking booking = engine.book(book.facilityName(), book.start(), book.end(), request.id().clientId());
                yield new ReplyPayload.Created(booking.id());
            }
            case SHIFT -> {
                ShiftBooking shift = (ShiftBooking) call;
                yield new ReplyPayload.Rescheduled(engine.shift(shift.bookingId(), shift.offset()));
            }
            case MONITOR -> {
                MonitorFacility monitor = (MonitorFacility) call;
                monitors.subscribe(monitor.facilityName(), remote, monitor.window());
                yield new ReplyPayload.Subscribed(monitor.window());
            }
            case LOOKUP_BOOKING -> {
                Booking booking = engine.lookup(((LookupBooking) call).bookingId());
                yield new ReplyPayload.Details(booking.facilityName(), booking.interval());
            }
            case CANCEL_BOOKING -> {
                engine.cancel(((CancelBooking) call).bookingId());
                yield new ReplyPayload.Acknowledged();
            }
            case EXTEND_BOOKING -> {
                ExtendBooking extend = (ExtendBooking) call;
                yield new ReplyPayload.Rescheduled(engine.extend(extend.bookingId(), extend.offset()));
            }
        };
    }
}
