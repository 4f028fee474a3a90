package com.questrail.booking.runtime;

import com.questrail.booking.client.BookingClient;
import com.questrail.booking.client.InvocationPolicy;
import com.questrail.booking.client.InvocationTimeoutException;
import com.questrail.booking.config.ClientConfig;
import com.questrail.booking.config.ServerConfig;
import com.questrail.booking.model.BookedInterval;
import com.questrail.booking.model.BookingId;
import com.questrail.booking.model.BookingRejectedException;
import com.questrail.booking.model.ClientId;
import com.questrail.booking.model.Interval;
import com.questrail.booking.model.MonitorEvent;
import com.questrail.booking.model.MutationKind;
import com.questrail.booking.model.ReplyPayload;
import com.questrail.booking.model.StatusCode;
import com.questrail.booking.model.TimePoint;
import com.questrail.booking.transport.lossy.LossProfile;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.DayOfWeek;
import java.time.Duration;
import java.util.EnumSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static java.time.DayOfWeek.MONDAY;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives real Netty UDP endpoints over the loopback interface.
 */
class LoopbackIntegrationTest {

    private static final InetSocketAddress EPHEMERAL = new InetSocketAddress("127.0.0.1", 0);

    private final List<BookingServerRuntime> servers = new ArrayList<>();
    private final List<BookingClientRuntime> clients = new ArrayList<>();

    @AfterEach
    void tearDown() {
        clients.forEach(BookingClientRuntime::stop);
        servers.forEach(BookingServerRuntime::stop);
    }

    private BookingServerRuntime startServer(ServerConfig.Builder config, long seed) {
        BookingServerRuntime server = BookingServerRuntime.builder()
                .withConfig(config.withBindAddress(EPHEMERAL).withFacilities("Room101", "Lab").build())
                .withRandom(new Random(seed))
                .build();
        server.start();
        servers.add(server);
        return server;
    }

    private BookingClient startClient(BookingServerRuntime server, LossProfile loss, InvocationPolicy policy, long seed) {
        BookingClientRuntime client = BookingClientRuntime.builder()
                .withConfig(ClientConfig.builder()
                        .withBindAddress(EPHEMERAL)
                        .withServerAddress(server.localAddress())
                        .withLossProfile(loss)
                        .withInvocationPolicy(policy)
                        .build())
                .withRandom(new Random(seed))
                .build();
        client.start();
        clients.add(client);
        return client.client();
    }

    private static TimePoint mon(int hour, int minute) {
        return TimePoint.of(MONDAY, hour, minute);
    }

    @Test
    void roomOneOhOneOverUdp() throws Exception {
        BookingServerRuntime server = startServer(ServerConfig.builder(), 1);
        BookingClient client = startClient(server, LossProfile.none(), InvocationPolicy.defaults(), 1);

        BookingId b1 = client.book("Room101", mon(9, 0), mon(10, 0));

        BookingRejectedException overlap = assertThrows(BookingRejectedException.class,
                () -> client.book("Room101", mon(9, 30), mon(10, 30)));
        assertEquals(StatusCode.OVERLAP, overlap.status());

        Interval shifted = client.shift(b1, Duration.ofMinutes(60));
        assertEquals(Interval.of(mon(10, 0), mon(11, 0)), shifted);

        Map<DayOfWeek, List<BookedInterval>> availability = client.queryAvailability("Room101", Set.of(MONDAY));
        assertEquals(List.of(new BookedInterval(b1, shifted)), availability.get(MONDAY));

        assertEquals(new ReplyPayload.Details("Room101", shifted), client.lookupBooking(b1));
        assertEquals(Interval.of(mon(10, 0), mon(11, 30)), client.extend(b1, Duration.ofMinutes(30)));
        client.cancel(b1);

        BookingRejectedException gone = assertThrows(BookingRejectedException.class, () -> client.lookupBooking(b1));
        assertEquals(StatusCode.BOOKING_NOT_FOUND, gone.status());
    }

    @Test
    void monitoringClientSeesAnotherClientsMutations() throws Exception {
        BookingServerRuntime server = startServer(ServerConfig.builder(), 2);
        BookingClient watcher = startClient(server, LossProfile.none(), InvocationPolicy.defaults(), 2);
        BookingClient booker = startClient(server, LossProfile.none(), InvocationPolicy.defaults(), 3);

        List<MonitorEvent> events = new CopyOnWriteArrayList<>();
        CountDownLatch twoEvents = new CountDownLatch(2);
        Duration granted = watcher.monitor("Room101", Duration.ofSeconds(2), e -> {
            events.add(e);
            twoEvents.countDown();
        });
        assertEquals(Duration.ofSeconds(2), granted);
        assertTrue(watcher.isMonitoring());
        assertThrows(IllegalStateException.class, () -> watcher.book("Lab", mon(9, 0), mon(10, 0)));

        BookingId id = booker.book("Room101", mon(9, 0), mon(10, 0));
        booker.book("Lab", mon(9, 0), mon(10, 0));
        booker.shift(id, Duration.ofMinutes(30));

        assertTrue(twoEvents.await(2, TimeUnit.SECONDS));
        assertEquals(List.of(MutationKind.BOOKED, MutationKind.SHIFTED), events.stream().map(MonitorEvent::kind).toList());

        watcher.awaitMonitoringEnd();
        assertFalse(watcher.isMonitoring());
        booker.cancel(id);
        Thread.sleep(100);
        assertEquals(2, events.size());
    }

    @Test
    void lossyNetworkStillBooksExactlyOnce() throws Exception {
        BookingServerRuntime server = startServer(ServerConfig.builder()
                .withLossProfile(new LossProfile(0.3, 0.3, true)), 4);
        InvocationPolicy patient = new InvocationPolicy(Duration.ofMillis(100), 40);
        BookingClient client = startClient(server, LossProfile.outbound(0.3, 0.5), patient, 5);

        List<BookingId> ids = new ArrayList<>();
        for (int hour = 8; hour < 12; hour++) {
            ids.add(client.book("Room101", mon(hour, 0), mon(hour + 1, 0)));
        }
        client.shift(ids.get(3), Duration.ofMinutes(60));

        List<BookedInterval> booked = server.engine().queryAvailability("Room101", Set.of(MONDAY)).get(MONDAY);
        assertEquals(4, booked.size());
        assertEquals(Interval.of(mon(12, 0), mon(13, 0)), server.engine().lookup(ids.get(3)).interval());
    }

    @Test
    void busyWeekFitsInOneAvailabilityReply() throws Exception {
        BookingServerRuntime server = startServer(ServerConfig.builder(), 7);
        BookingClient client = startClient(server, LossProfile.none(), InvocationPolicy.defaults(), 7);

        // 140 half-hour slots; the encoded reply is well past 2048 bytes
        ClientId owner = ClientId.random();
        for (DayOfWeek day : DayOfWeek.values()) {
            for (int slot = 0; slot < 20; slot++) {
                int minutes = 8 * 60 + slot * 30;
                server.engine().book("Room101",
                        TimePoint.of(day, minutes / 60, minutes % 60),
                        TimePoint.of(day, (minutes + 30) / 60, (minutes + 30) % 60),
                        owner);
            }
        }

        Map<DayOfWeek, List<BookedInterval>> availability =
                client.queryAvailability("Room101", EnumSet.allOf(DayOfWeek.class));

        assertEquals(7, availability.size());
        for (DayOfWeek day : DayOfWeek.values()) {
            List<BookedInterval> booked = availability.get(day);
            assertEquals(20, booked.size());
            assertEquals(TimePoint.of(day, 8, 0), booked.get(0).interval().start());
            assertEquals(TimePoint.of(day, 18, 0), booked.get(19).interval().end());
        }
    }

    @Test
    void unreachableServerEndsInTimeout() {
        BookingServerRuntime server = startServer(ServerConfig.builder(), 6);
        InvocationPolicy impatient = new InvocationPolicy(Duration.ofMillis(50), 2);
        BookingClient client = startClient(server, LossProfile.outbound(1.0, 0.0), impatient, 6);

        InvocationTimeoutException e = assertThrows(InvocationTimeoutException.class,
                () -> client.book("Room101", mon(9, 0), mon(10, 0)));
        assertEquals(3, e.attempts());
        assertTrue(server.engine().queryAvailability("Room101", Set.of(MONDAY)).get(MONDAY).isEmpty());
    }
}
