package com.questrail.booking.codec.impl;

import com.questrail.booking.codec.MalformedMessageException;
import com.questrail.booking.codec.MessageDecoder;
import com.questrail.booking.model.BookFacility;
import com.questrail.booking.model.BookedInterval;
import com.questrail.booking.model.BookingId;
import com.questrail.booking.model.CancelBooking;
import com.questrail.booking.model.ClientId;
import com.questrail.booking.model.ExtendBooking;
import com.questrail.booking.model.Interval;
import com.questrail.booking.model.LookupBooking;
import com.questrail.booking.model.MonitorEvent;
import com.questrail.booking.model.MonitorFacility;
import com.questrail.booking.model.MutationKind;
import com.questrail.booking.model.Operation;
import com.questrail.booking.model.QueryAvailability;
import com.questrail.booking.model.Reply;
import com.questrail.booking.model.ReplyPayload;
import com.questrail.booking.model.Request;
import com.questrail.booking.model.RequestId;
import com.questrail.booking.model.ServiceCall;
import com.questrail.booking.model.ShiftBooking;
import com.questrail.booking.model.StatusCode;
import com.questrail.booking.model.TimePoint;
import com.questrail.booking.model.WireMessage;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DefaultMessageDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link MessageDecoder}.
 *
 * <p>Decoding proceeds in two steps:</p>
 * <ol>
 *   <li>Message kind and header (request id, opcode, status)</li>
 *   <li>Operation-specific body, followed by a check that nothing trails it</li>
 * </ol>
 *
 * <p>A failure in step 2 of a request is re-thrown with the already decoded
 * request id attached, so the server can still address a
 * {@link StatusCode#MALFORMED_REQUEST} reply to the sender.</p>
 */
public final class DefaultMessageDecoder implements MessageDecoder
{
    @Override
    public WireMessage decode(byte[] datagram)
    {
        Objects.requireNonNull(datagram, "datagram");

        WireReader in = new WireReader(datagram);
        final int kind = in.u8("message kind");

        try {
            return switch (kind) {
                case WireFormat.KIND_REQUEST -> decodeRequest(in);
                case WireFormat.KIND_REPLY -> decodeReply(in);
                case WireFormat.KIND_MONITOR_EVENT -> decodeMonitorEvent(in);
                default -> throw new MalformedMessageException(
                        "Unknown message kind: 0x" + Integer.toHexString(kind));
            };
        } catch (IllegalArgumentException e) {
            // model constructors reject values the wire format can carry
            throw new MalformedMessageException(e.getMessage(), e);
        }
    }

    // ========================================================================
    // Requests
    // ========================================================================

    private static Request decodeRequest(WireReader in)
    {
        RequestId id = readRequestId(in);
        Operation operation = readOperation(in);

        try {
            ServiceCall call = switch (operation) {
                case QUERY_AVAILABILITY -> new QueryAvailability(in.string("facility name"), in.daySet("days"));
                case BOOK -> new BookFacility(in.string("facility name"), in.timePoint("start"), in.timePoint("end"));
                case SHIFT -> new ShiftBooking(readBookingId(in), Duration.ofMinutes(in.i32("offset")));
                case MONITOR -> new MonitorFacility(in.string("facility name"), Duration.ofSeconds(in.u32("window")));
                case LOOKUP_BOOKING -> new LookupBooking(readBookingId(in));
                case CANCEL_BOOKING -> new CancelBooking(readBookingId(in));
                case EXTEND_BOOKING -> new ExtendBooking(readBookingId(in), Duration.ofMinutes(in.i32("offset")));
            };
            in.expectEnd();
            return new Request(id, call);
        } catch (MalformedMessageException | IllegalArgumentException e) {
            throw new MalformedMessageException(e.getMessage(), id, operation, e);
        }
    }

    // ========================================================================
    // Replies
    // ========================================================================

    private static Reply decodeReply(WireReader in)
    {
        RequestId id = readRequestId(in);
        Operation operation = readOperation(in);

        int code = in.u8("status");
        StatusCode status = StatusCode.fromCode(code)
                .orElseThrow(() -> new MalformedMessageException("Unknown status code: " + code));

        final ReplyPayload payload;
        if (!status.isSuccess()) {
            payload = new ReplyPayload.Failure(in.string("failure message"));
        }
        else {
            payload = switch (operation) {
                case QUERY_AVAILABILITY -> readAvailability(in);
                case BOOK -> new ReplyPayload.Created(readBookingId(in));
                case SHIFT, EXTEND_BOOKING -> new ReplyPayload.Rescheduled(in.interval("interval"));
                case MONITOR -> new ReplyPayload.Subscribed(Duration.ofSeconds(in.u32("window")));
                case LOOKUP_BOOKING -> new ReplyPayload.Details(in.string("facility name"), in.interval("interval"));
                case CANCEL_BOOKING -> new ReplyPayload.Acknowledged();
            };
        }
        in.expectEnd();
        return new Reply(id, operation, status, payload);
    }

    private static ReplyPayload.Availability readAvailability(WireReader in)
    {
        int dayCount = in.u8("day count");
        Map<DayOfWeek, List<BookedInterval>> days = new EnumMap<>(DayOfWeek.class);
        for (int d = 0; d < dayCount; d++) {
            int index = in.u8("day");
            if (index > 6) {
                throw new MalformedMessageException("day index out of range: " + index);
            }
            DayOfWeek day = TimePoint.dayOfIndex(index);
            if (days.containsKey(day)) {
                throw new MalformedMessageException("day listed twice: " + day);
            }

            int count = in.u16("interval count");
            List<BookedInterval> slots = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                BookingId bookingId = readBookingId(in);
                Interval interval = in.interval("booked interval");
                slots.add(new BookedInterval(bookingId, interval));
            }
            days.put(day, slots);
        }
        return new ReplyPayload.Availability(days);
    }

    // ========================================================================
    // Monitor events
    // ========================================================================

    private static MonitorEvent decodeMonitorEvent(WireReader in)
    {
        String facility = in.string("facility name");
        int code = in.u8("mutation kind");
        MutationKind kind = MutationKind.fromCode(code)
                .orElseThrow(() -> new MalformedMessageException("Unknown mutation kind: " + code));
        BookingId bookingId = readBookingId(in);
        Interval interval = in.interval("interval");
        long revision = in.u32("revision");
        in.expectEnd();
        return new MonitorEvent(facility, kind, bookingId, interval, revision);
    }

    // ========================================================================
    // Shared pieces
    // ========================================================================

    private static RequestId readRequestId(WireReader in)
    {
        ClientId clientId = new ClientId(in.uuid("client id"));
        long sequence = in.u32("sequence number");
        return new RequestId(clientId, sequence);
    }

    private static Operation readOperation(WireReader in)
    {
        int opcode = in.u8("opcode");
        return Operation.fromOpcode(opcode)
                .orElseThrow(() -> new MalformedMessageException(
                        "Unknown opcode: 0x" + Integer.toHexString(opcode)));
    }

    private static BookingId readBookingId(WireReader in)
    {
        return new BookingId(in.uuid("booking id"));
    }
}
