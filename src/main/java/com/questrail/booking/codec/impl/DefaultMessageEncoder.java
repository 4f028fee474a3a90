package com.questrail.booking.codec.impl;

import com.questrail.booking.codec.MessageEncoder;
import com.questrail.booking.model.BookFacility;
import com.questrail.booking.model.BookedInterval;
import com.questrail.booking.model.CancelBooking;
import com.questrail.booking.model.ExtendBooking;
import com.questrail.booking.model.Interval;
import com.questrail.booking.model.LookupBooking;
import com.questrail.booking.model.MonitorEvent;
import com.questrail.booking.model.MonitorFacility;
import com.questrail.booking.model.Operation;
import com.questrail.booking.model.QueryAvailability;
import com.questrail.booking.model.Reply;
import com.questrail.booking.model.ReplyPayload;
import com.questrail.booking.model.Request;
import com.questrail.booking.model.RequestId;
import com.questrail.booking.model.ServiceCall;
import com.questrail.booking.model.ShiftBooking;
import com.questrail.booking.model.TimePoint;
import com.questrail.booking.model.WireMessage;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DefaultMessageEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link MessageEncoder}; the mechanical inverse of
 * {@link DefaultMessageDecoder}.
 *
 * <p>A successful reply must carry the payload shape belonging to its echoed
 * operation. A mismatch is a programming error and is rejected with
 * {@link IllegalArgumentException} rather than producing bytes the peer
 * cannot decode.</p>
 */
public final class DefaultMessageEncoder implements MessageEncoder
{
    @Override
    public byte[] encode(WireMessage message)
    {
        Objects.requireNonNull(message, "message");

        WireWriter out = new WireWriter();
        if (message instanceof Request request) {
            encodeRequest(request, out);
        }
        else if (message instanceof Reply reply) {
            encodeReply(reply, out);
        }
        else if (message instanceof MonitorEvent event) {
            encodeMonitorEvent(event, out);
        }
        else {
            throw new IllegalArgumentException("Unsupported message type: " + message.getClass().getName());
        }
        return out.toByteArray();
    }

    // ========================================================================
    // Requests
    // ========================================================================

    private static void encodeRequest(Request request, WireWriter out)
    {
        out.u8(WireFormat.KIND_REQUEST);
        writeRequestId(request.id(), out);
        out.u8(request.operation().opcode());

        ServiceCall call = request.call();
        switch (call.operation()) {
            case QUERY_AVAILABILITY -> {
                QueryAvailability query = (QueryAvailability) call;
                out.string(query.facilityName()).daySet(query.days());
            }
            case BOOK -> {
                BookFacility book = (BookFacility) call;
                out.string(book.facilityName()).timePoint(book.start()).timePoint(book.end());
            }
            case SHIFT -> {
                ShiftBooking shift = (ShiftBooking) call;
                out.uuid(shift.bookingId().value()).i32((int) shift.offset().toMinutes());
            }
            case MONITOR -> {
                MonitorFacility monitor = (MonitorFacility) call;
                out.string(monitor.facilityName()).u32(monitor.window().getSeconds());
            }
            case LOOKUP_BOOKING -> out.uuid(((LookupBooking) call).bookingId().value());
            case CANCEL_BOOKING -> out.uuid(((CancelBooking) call).bookingId().value());
            case EXTEND_BOOKING -> {
                ExtendBooking extend = (ExtendBooking) call;
                out.uuid(extend.bookingId().value()).i32((int) extend.offset().toMinutes());
            }
        }
    }

    // ========================================================================
    // Replies
    // ========================================================================

    private static void encodeReply(Reply reply, WireWriter out)
    {
        out.u8(WireFormat.KIND_REPLY);
        writeRequestId(reply.id(), out);
        out.u8(reply.operation().opcode());
        out.u8(reply.status().code());

        if (!reply.isSuccess()) {
            out.string(((ReplyPayload.Failure) reply.payload()).message());
            return;
        }

        Operation operation = reply.operation();
        ReplyPayload payload = reply.payload();
        switch (operation) {
            case QUERY_AVAILABILITY -> writeAvailability(expect(payload, ReplyPayload.Availability.class, operation), out);
            case BOOK -> out.uuid(expect(payload, ReplyPayload.Created.class, operation).bookingId().value());
            case SHIFT, EXTEND_BOOKING -> writeInterval(expect(payload, ReplyPayload.Rescheduled.class, operation).interval(), out);
            case MONITOR -> out.u32(expect(payload, ReplyPayload.Subscribed.class, operation).window().getSeconds());
            case LOOKUP_BOOKING -> {
                ReplyPayload.Details details = expect(payload, ReplyPayload.Details.class, operation);
                out.string(details.facilityName());
                writeInterval(details.interval(), out);
            }
            case CANCEL_BOOKING -> expect(payload, ReplyPayload.Acknowledged.class, operation);
        }
    }

    private static void writeAvailability(ReplyPayload.Availability availability, WireWriter out)
    {
        Map<DayOfWeek, List<BookedInterval>> days = availability.days();
        out.u8(days.size());
        for (Map.Entry<DayOfWeek, List<BookedInterval>> entry : days.entrySet()) {
            List<BookedInterval> slots = entry.getValue();
            if (slots.size() > 0xFFFF) {
                throw new IllegalArgumentException("too many intervals for " + entry.getKey());
            }
            out.u8(TimePoint.indexOf(entry.getKey()));
            out.u16(slots.size());
            for (BookedInterval slot : slots) {
                out.uuid(slot.bookingId().value());
                writeInterval(slot.interval(), out);
            }
        }
    }

    // ========================================================================
    // Monitor events
    // ========================================================================

    private static void encodeMonitorEvent(MonitorEvent event, WireWriter out)
    {
        out.u8(WireFormat.KIND_MONITOR_EVENT);
        out.string(event.facilityName());
        out.u8(event.kind().code());
        out.uuid(event.bookingId().value());
        writeInterval(event.interval(), out);
        out.u32(event.revision());
    }

    // ========================================================================
    // Shared pieces
    // ========================================================================

    private static void writeRequestId(RequestId id, WireWriter out)
    {
        out.uuid(id.clientId().value());
        out.u32(id.sequence());
    }

    private static void writeInterval(Interval interval, WireWriter out)
    {
        out.timePoint(interval.start()).timePoint(interval.end());
    }

    private static <T extends ReplyPayload> T expect(ReplyPayload payload, Class<T> type, Operation operation)
    {
        if (!type.isInstance(payload)) {
            throw new IllegalArgumentException(
                    operation + " reply requires " + type.getSimpleName() + " payload, got " + payload);
        }
        return type.cast(payload);
    }
}
