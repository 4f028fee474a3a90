package com.questrail.booking.monitor;

import com.questrail.booking.codec.MessageEncoder;
import com.questrail.booking.facility.FacilityMutationListener;
import com.questrail.booking.facility.FacilityStore;
import com.questrail.booking.internal.time.MonotonicClock;
import com.questrail.booking.model.BookingRejectedException;
import com.questrail.booking.model.MonitorEvent;
import com.questrail.booking.model.StatusCode;
import com.questrail.booking.transport.DatagramEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MonitorRegistry
 * =============================================================================
 * Tracks monitoring subscriptions per facility and pushes a
 * {@link MonitorEvent} datagram to every live subscriber when the facility
 * changes.
 *
 * <h2>Delivery</h2>
 * Pushes are fire-and-forget through the server endpoint (lossy when the
 * server is configured so). There is no acknowledgement and no retry.
 *
 * <h2>Ordering</h2>
 * {@link #onMutation(MonitorEvent)} runs under the mutated facility's lock,
 * so one subscriber receives one facility's events in application order
 * (subject to network loss). Lock order is facility lock, then registry lock;
 * the registry never calls back into the engine.
 *
 * <h2>Expiry</h2>
 * A subscription is live while {@code now < expiry} on the monotonic clock.
 * Expired entries are removed lazily on each subscribe and mutation, and by
 * {@link #purgeExpired()} which the server runtime calls periodically.
 */
public final class MonitorRegistry implements FacilityMutationListener
{
    private static final Logger log = LoggerFactory.getLogger(MonitorRegistry.class);

    public static final Duration MIN_WINDOW = Duration.ofSeconds(1);
    public static final Duration MAX_WINDOW = Duration.ofHours(24);

    private final FacilityStore store;
    private final DatagramEndpoint endpoint;
    private final MessageEncoder encoder;
    private final MonotonicClock clock;

    private final Object lock = new Object();
    private final Map<String, Map<SocketAddress, MonitorSubscription>> byFacility = new HashMap<>();

    public MonitorRegistry(FacilityStore store, DatagramEndpoint endpoint, MessageEncoder encoder, MonotonicClock clock)
    {
        this.store = Objects.requireNonNull(store, "store");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Registers (or renews) {@code subscriber}'s interest in a facility.
     *
     * @throws BookingRejectedException {@link StatusCode#FACILITY_NOT_FOUND} for an
     *         unknown facility, {@link StatusCode#INVALID_REQUEST} for a window
     *         outside one second to 24 hours
     */
    public MonitorSubscription subscribe(String facilityName, SocketAddress subscriber, Duration window)
    {
        Objects.requireNonNull(subscriber, "subscriber");
        Objects.requireNonNull(window, "window");

        store.require(facilityName);
        if (window.compareTo(MIN_WINDOW) < 0 || window.compareTo(MAX_WINDOW) > 0) {
            throw new BookingRejectedException(StatusCode.INVALID_REQUEST,
                    "monitor window must be between " + MIN_WINDOW.getSeconds() + " s and "
                            + MAX_WINDOW.getSeconds() + " s (was " + window.getSeconds() + " s)");
        }

        MonitorSubscription subscription =
                new MonitorSubscription(facilityName, subscriber, clock.deadlineAfter(window));
        synchronized (lock) {
            purgeExpiredLocked(clock.nowNanos());
            byFacility.computeIfAbsent(facilityName, k -> new LinkedHashMap<>()).put(subscriber, subscription);
        }
        log.info("{} monitoring {} for {} s", subscriber, facilityName, window.getSeconds());
        return subscription;
    }

    @Override
    public void onMutation(MonitorEvent event)
    {
        List<SocketAddress> targets = new ArrayList<>();
        synchronized (lock) {
            long now = clock.nowNanos();
            purgeExpiredLocked(now);
            Map<SocketAddress, MonitorSubscription> subs = byFacility.get(event.facilityName());
            if (subs != null) {
                for (MonitorSubscription s : subs.values()) {
                    if (s.isActiveAt(now)) {
                        targets.add(s.subscriber());
                    }
                }
            }
        }
        if (targets.isEmpty()) {
            return;
        }

        byte[] datagram = encoder.encode(event);
        for (SocketAddress target : targets) {
            log.debug("Pushing {} of {} to {}", event.kind(), event.bookingId(), target);
            endpoint.send(target, datagram);
        }
    }

    /**
     * @return number of subscriptions removed
     */
    public int purgeExpired()
    {
        synchronized (lock) {
            return purgeExpiredLocked(clock.nowNanos());
        }
    }

    public List<MonitorSubscription> activeSubscriptions(String facilityName)
    {
        synchronized (lock) {
            long now = clock.nowNanos();
            Map<SocketAddress, MonitorSubscription> subs = byFacility.get(facilityName);
            if (subs == null) {
                return List.of();
            }
            List<MonitorSubscription> live = new ArrayList<>();
            for (MonitorSubscription s : subs.values()) {
                if (s.isActiveAt(now)) {
                    live.add(s);
                }
            }
            return live;
        }
    }

    /** Drops every subscription; called on server shutdown. */
    public void clear()
    {
        synchronized (lock) {
            byFacility.clear();
        }
    }

    private int purgeExpiredLocked(long now)
    {
        int removed = 0;
        Iterator<Map<SocketAddress, MonitorSubscription>> facilities = byFacility.values().iterator();
        while (facilities.hasNext()) {
            Map<SocketAddress, MonitorSubscription> subs = facilities.next();
            Iterator<MonitorSubscription> it = subs.values().iterator();
            while (it.hasNext()) {
                MonitorSubscription s = it.next();
                if (!s.isActiveAt(now)) {
                    it.remove();
                    removed++;
                    log.debug("Subscription of {} to {} expired", s.subscriber(), s.facilityName());
                }
            }
            if (subs.isEmpty()) {
                facilities.remove();
            }
        }
        return removed;
    }
}
