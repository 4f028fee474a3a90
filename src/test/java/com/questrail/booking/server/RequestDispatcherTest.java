package com.questrail.booking.server;

import com.questrail.booking.codec.impl.DefaultMessageDecoder;
import com.questrail.booking.codec.impl.DefaultMessageEncoder;
import com.questrail.booking.facility.BookingEngine;
import com.questrail.booking.facility.FacilityStore;
import com.questrail.booking.model.BookFacility;
import com.questrail.booking.model.BookingId;
import com.questrail.booking.model.CancelBooking;
import com.questrail.booking.model.ClientId;
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
import com.questrail.booking.model.StatusCode;
import com.questrail.booking.model.TimePoint;
import com.questrail.booking.monitor.MonitorRegistry;
import com.questrail.booking.time.ManualMonotonicClock;
import com.questrail.booking.transport.FakeDatagramEndpoint;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static java.time.DayOfWeek.MONDAY;
import static org.junit.jupiter.api.Assertions.*;

class RequestDispatcherTest {

    private static final SocketAddress CLIENT_ADDRESS = new InetSocketAddress("127.0.0.1", 45000);
    private static final ClientId CLIENT = ClientId.random();

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final FakeDatagramEndpoint endpoint = new FakeDatagramEndpoint();
    private final DefaultMessageEncoder encoder = new DefaultMessageEncoder();
    private final DefaultMessageDecoder decoder = new DefaultMessageDecoder();

    private BookingEngine engine;

    private RequestDispatcher dispatcher(boolean replyCacheEnabled) {
        FacilityStore store = FacilityStore.of(List.of("Room101"));
        MonitorRegistry monitors = new MonitorRegistry(store, endpoint, encoder, clock);
        engine = new BookingEngine(store, monitors);
        ReplyCache cache = replyCacheEnabled
                ? new ReplyCache(Duration.ofSeconds(22), 100, clock)
                : ReplyCache.disabled(clock);
        RequestDispatcher dispatcher = new RequestDispatcher(engine, monitors, endpoint, decoder, encoder, cache, Runnable::run);
        endpoint.setListener(dispatcher);
        return dispatcher;
    }

    private byte[] request(long sequence, ServiceCall call) {
        return encoder.encode(new Request(RequestId.of(CLIENT, sequence), call));
    }

    private Reply lastReply() {
        return (Reply) decoder.decode(endpoint.last().payload());
    }

    private static BookFacility bookMonday(int hour) {
        return new BookFacility("Room101", TimePoint.of(MONDAY, hour, 0), TimePoint.of(MONDAY, hour + 1, 0));
    }

    @Test
    void duplicateBookGetsIdenticalReplyAndBooksOnce() {
        dispatcher(true);
        byte[] book = request(5, bookMonday(9));

        endpoint.injectDatagram(CLIENT_ADDRESS, book);
        endpoint.injectDatagram(CLIENT_ADDRESS, book);

        List<FakeDatagramEndpoint.Sent> sent = endpoint.sent();
        assertEquals(2, sent.size());
        assertArrayEquals(sent.get(0).payload(), sent.get(1).payload());

        Reply reply = lastReply();
        assertEquals(StatusCode.SUCCESS, reply.status());
        BookingId b1 = ((ReplyPayload.Created) reply.payload()).bookingId();
        assertEquals(1, engine.queryAvailability("Room101", Set.of(MONDAY)).get(MONDAY).size());
        assertEquals(b1, engine.queryAvailability("Room101", Set.of(MONDAY)).get(MONDAY).get(0).bookingId());
    }

    @Test
    void duplicateShiftIsAppliedOnce() {
        dispatcher(true);
        endpoint.injectDatagram(CLIENT_ADDRESS, request(1, bookMonday(9)));
        BookingId id = ((ReplyPayload.Created) lastReply().payload()).bookingId();

        byte[] shift = request(2, new ShiftBooking(id, Duration.ofMinutes(60)));
        endpoint.injectDatagram(CLIENT_ADDRESS, shift);
        endpoint.injectDatagram(CLIENT_ADDRESS, shift);

        Interval expected = Interval.of(TimePoint.of(MONDAY, 10, 0), TimePoint.of(MONDAY, 11, 0));
        assertEquals(new ReplyPayload.Rescheduled(expected), lastReply().payload());
        assertEquals(expected, engine.lookup(id).interval());
    }

    @Test
    void rejectionsAreCachedLikeSuccesses() {
        dispatcher(true);
        endpoint.injectDatagram(CLIENT_ADDRESS, request(1, bookMonday(9)));
        BookingId id = ((ReplyPayload.Created) lastReply().payload()).bookingId();

        byte[] cancelTwice = request(2, new CancelBooking(id));
        endpoint.injectDatagram(CLIENT_ADDRESS, cancelTwice);
        endpoint.injectDatagram(CLIENT_ADDRESS, cancelTwice);
        assertEquals(StatusCode.SUCCESS, lastReply().status());

        endpoint.injectDatagram(CLIENT_ADDRESS, request(3, new CancelBooking(id)));
        assertEquals(StatusCode.BOOKING_NOT_FOUND, lastReply().status());
    }

    @Test
    void withoutReplyCacheDuplicateBookIsExecutedAgain() {
        dispatcher(false);
        byte[] book = request(5, bookMonday(9));

        endpoint.injectDatagram(CLIENT_ADDRESS, book);
        endpoint.injectDatagram(CLIENT_ADDRESS, book);

        assertEquals(StatusCode.SUCCESS, ((Reply) decoder.decode(endpoint.sent().get(0).payload())).status());
        assertEquals(StatusCode.OVERLAP, lastReply().status());
    }

    @Test
    void idempotentRequestsExecuteOnEveryDelivery() {
        dispatcher(true);
        byte[] query = request(1, new QueryAvailability("Room101", Set.of(MONDAY)));

        endpoint.injectDatagram(CLIENT_ADDRESS, query);
        assertEquals(List.of(), ((ReplyPayload.Availability) lastReply().payload()).days().get(MONDAY));

        endpoint.injectDatagram(CLIENT_ADDRESS, request(2, bookMonday(9)));
        endpoint.injectDatagram(CLIENT_ADDRESS, query);

        assertEquals(1, ((ReplyPayload.Availability) lastReply().payload()).days().get(MONDAY).size());
    }

    @Test
    void monitorSubscribesTheSenderAddress() {
        dispatcher(true);
        endpoint.injectDatagram(CLIENT_ADDRESS, request(1, new MonitorFacility("Room101", Duration.ofSeconds(30))));
        assertEquals(new ReplyPayload.Subscribed(Duration.ofSeconds(30)), lastReply().payload());

        SocketAddress booker = new InetSocketAddress("127.0.0.1", 46000);
        endpoint.injectDatagram(booker, request(2, bookMonday(9)));

        List<byte[]> pushed = endpoint.payloadsTo(CLIENT_ADDRESS);
        assertInstanceOf(MonitorEvent.class, decoder.decode(pushed.get(pushed.size() - 1)));
    }

    @Test
    void lookupReportsFacilityAndInterval() {
        dispatcher(true);
        endpoint.injectDatagram(CLIENT_ADDRESS, request(1, bookMonday(14)));
        BookingId id = ((ReplyPayload.Created) lastReply().payload()).bookingId();

        endpoint.injectDatagram(CLIENT_ADDRESS, request(2, new LookupBooking(id)));

        ReplyPayload.Details details = (ReplyPayload.Details) lastReply().payload();
        assertEquals("Room101", details.facilityName());
        assertEquals(TimePoint.of(MONDAY, 14, 0), details.interval().start());
    }

    @Test
    void domainErrorsBecomeStatusReplies() {
        dispatcher(true);
        endpoint.injectDatagram(CLIENT_ADDRESS, request(1, new BookFacility("Nowhere",
                TimePoint.of(MONDAY, 9, 0), TimePoint.of(MONDAY, 10, 0))));
        Reply reply = lastReply();

        assertEquals(StatusCode.FACILITY_NOT_FOUND, reply.status());
        assertEquals(Operation.BOOK, reply.operation());
        assertEquals(RequestId.of(CLIENT, 1), reply.id());
    }

    @Test
    void malformedBodyWithReadableHeaderGetsMalformedReply() {
        dispatcher(true);
        byte[] valid = request(4, bookMonday(9));
        byte[] truncated = Arrays.copyOf(valid, valid.length - 2);

        endpoint.injectDatagram(CLIENT_ADDRESS, truncated);

        Reply reply = lastReply();
        assertEquals(StatusCode.MALFORMED_REQUEST, reply.status());
        assertEquals(RequestId.of(CLIENT, 4), reply.id());
    }

    @Test
    void unreadableDatagramsAreDroppedSilently() {
        dispatcher(true);
        endpoint.injectDatagram(CLIENT_ADDRESS, new byte[] {0x01, 0x02});
        endpoint.injectDatagram(CLIENT_ADDRESS, new byte[0]);
        endpoint.injectDatagram(CLIENT_ADDRESS,
                encoder.encode(Reply.failure(RequestId.of(CLIENT, 1), Operation.BOOK, StatusCode.OVERLAP, "x")));
        assertTrue(endpoint.sent().isEmpty());
    }
}
