package com.questrail.booking.codec.impl;

import com.questrail.booking.codec.MalformedMessageException;
import com.questrail.booking.model.BookFacility;
import com.questrail.booking.model.BookedInterval;
import com.questrail.booking.model.BookingId;
import com.questrail.booking.model.ClientId;
import com.questrail.booking.model.ExtendBooking;
import com.questrail.booking.model.Interval;
import com.questrail.booking.model.MonitorEvent;
import com.questrail.booking.model.MonitorFacility;
import com.questrail.booking.model.MutationKind;
import com.questrail.booking.model.Operation;
import com.questrail.booking.model.QueryAvailability;
import com.questrail.booking.model.Reply;
import com.questrail.booking.model.ReplyPayload;
import com.questrail.booking.model.Request;
import com.questrail.booking.model.RequestId;
import com.questrail.booking.model.StatusCode;
import com.questrail.booking.model.TimePoint;
import com.questrail.booking.model.WireMessage;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.time.DayOfWeek;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static java.time.DayOfWeek.MONDAY;
import static java.time.DayOfWeek.TUESDAY;
import static org.junit.jupiter.api.Assertions.*;

class DefaultMessageDecoderTest {

    private static final ClientId CLIENT = new ClientId(UUID.fromString("00000000-0000-0000-0000-00000000abcd"));
    private static final BookingId BOOKING = new BookingId(UUID.fromString("11111111-2222-3333-4444-555555555555"));

    private final DefaultMessageEncoder encoder = new DefaultMessageEncoder();
    private final DefaultMessageDecoder decoder = new DefaultMessageDecoder();

    @Test
    void decodesWhatTheEncoderProduces() {
        List<WireMessage> messages = List.of(
                new Request(RequestId.of(CLIENT, 1), new QueryAvailability("Room101", EnumSet.of(MONDAY, TUESDAY))),
                new Request(RequestId.of(CLIENT, 2),
                        new BookFacility("Room101", TimePoint.of(MONDAY, 9, 0), TimePoint.of(MONDAY, 10, 0))),
                new Request(RequestId.of(CLIENT, 3), new ExtendBooking(BOOKING, Duration.ofMinutes(-15))),
                new Request(RequestId.of(CLIENT, 4), new MonitorFacility("Ümlaut-Hall", Duration.ofSeconds(30))),
                Reply.success(RequestId.of(CLIENT, 1), Operation.QUERY_AVAILABILITY,
                        new ReplyPayload.Availability(Map.of(MONDAY, List.of(new BookedInterval(BOOKING, nineToTen()))))),
                Reply.success(RequestId.of(CLIENT, 5), Operation.LOOKUP_BOOKING,
                        new ReplyPayload.Details("Room101", nineToTen())),
                Reply.success(RequestId.of(CLIENT, 6), Operation.CANCEL_BOOKING, new ReplyPayload.Acknowledged()),
                Reply.failure(RequestId.of(CLIENT, 7), Operation.SHIFT, StatusCode.BOOKING_NOT_FOUND, "gone"),
                new MonitorEvent("Room101", MutationKind.CANCELLED, BOOKING, nineToTen(), 0xFFFF_FFFFL));

        for (WireMessage message : messages) {
            assertEquals(message, decoder.decode(encoder.encode(message)), () -> "round trip of " + message);
        }
    }

    @Test
    void truncatedDatagramIsMalformed() {
        byte[] full = encoder.encode(new Request(RequestId.of(CLIENT, 1),
                new BookFacility("Room101", TimePoint.of(MONDAY, 9, 0), TimePoint.of(MONDAY, 10, 0))));

        assertThrows(MalformedMessageException.class, () -> decoder.decode(new byte[0]));
        assertThrows(MalformedMessageException.class, () -> decoder.decode(Arrays.copyOf(full, 10)));
        assertThrows(MalformedMessageException.class, () -> decoder.decode(Arrays.copyOf(full, full.length - 1)));
    }

    @Test
    void trailingBytesAreMalformed() {
        byte[] full = encoder.encode(Reply.success(RequestId.of(CLIENT, 6), Operation.CANCEL_BOOKING,
                new ReplyPayload.Acknowledged()));

        assertThrows(MalformedMessageException.class, () -> decoder.decode(Arrays.copyOf(full, full.length + 1)));
    }

    @Test
    void unknownKindIsMalformed() {
        assertThrows(MalformedMessageException.class, () -> decoder.decode(new byte[] {0x7F}));
    }

    @Test
    void unknownOpcodeCarriesNoRequestId() {
        byte[] datagram = header(0x42).toByteArray();

        MalformedMessageException e = assertThrows(MalformedMessageException.class, () -> decoder.decode(datagram));
        assertTrue(e.requestId().isEmpty());
    }

    @Test
    void badBodyAfterReadableHeaderCarriesRequestId() {
        ByteArrayOutputStream out = header(Operation.BOOK.opcode());
        out.writeBytes(new byte[] {0, 1, 'R'});
        out.writeBytes(new byte[] {0, 24, 0});   // hour 24
        out.writeBytes(new byte[] {0, 10, 0});

        MalformedMessageException e = assertThrows(MalformedMessageException.class,
                () -> decoder.decode(out.toByteArray()));
        assertEquals(RequestId.of(CLIENT, 9), e.requestId().orElseThrow());
        assertEquals(Operation.BOOK, e.operation().orElseThrow());
    }

    @Test
    void reservedDayBitIsMalformed() {
        ByteArrayOutputStream out = header(Operation.QUERY_AVAILABILITY.opcode());
        out.writeBytes(new byte[] {0, 1, 'R', (byte) 0x81});

        assertThrows(MalformedMessageException.class, () -> decoder.decode(out.toByteArray()));
    }

    @Test
    void invalidUtf8IsMalformed() {
        ByteArrayOutputStream out = header(Operation.MONITOR.opcode());
        out.writeBytes(new byte[] {0, 2, (byte) 0xC3, (byte) 0x28, 0, 0, 0, 10});

        assertThrows(MalformedMessageException.class, () -> decoder.decode(out.toByteArray()));
    }

    @Test
    void replyIntervalMustBeOrdered() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(0x02);
        writeRequestId(out, 3);
        out.write(Operation.SHIFT.opcode());
        out.write(StatusCode.SUCCESS.code());
        out.writeBytes(new byte[] {0, 10, 0, 0, 9, 0});

        assertThrows(MalformedMessageException.class, () -> decoder.decode(out.toByteArray()));
    }

    @Test
    void unknownStatusIsMalformed() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(0x02);
        writeRequestId(out, 3);
        out.write(Operation.BOOK.opcode());
        out.write(99);
        out.writeBytes(new byte[] {0, 0});

        assertThrows(MalformedMessageException.class, () -> decoder.decode(out.toByteArray()));
    }

    private static Interval nineToTen() {
        return Interval.of(TimePoint.of(MONDAY, 9, 0), TimePoint.of(MONDAY, 10, 0));
    }

    private static ByteArrayOutputStream header(int opcode) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(0x01);
        writeRequestId(out, 9);
        out.write(opcode);
        return out;
    }

    private static void writeRequestId(ByteArrayOutputStream out, int sequence) {
        ByteBuffer id = ByteBuffer.allocate(20);
        id.putLong(CLIENT.value().getMostSignificantBits());
        id.putLong(CLIENT.value().getLeastSignificantBits());
        id.putInt(sequence);
        out.writeBytes(id.array());
    }
}
