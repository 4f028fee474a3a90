package com.questrail.booking.runtime;

import com.questrail.booking.codec.MessageDecoder;
import com.questrail.booking.codec.MessageEncoder;
import com.questrail.booking.codec.impl.DefaultMessageDecoder;
import com.questrail.booking.codec.impl.DefaultMessageEncoder;
import com.questrail.booking.config.ServerConfig;
import com.questrail.booking.facility.BookingEngine;
import com.questrail.booking.facility.FacilityStore;
import com.questrail.booking.internal.time.MonotonicClock;
import com.questrail.booking.internal.time.SystemMonotonicClock;
import com.questrail.booking.monitor.MonitorRegistry;
import com.questrail.booking.server.ReplyCache;
import com.questrail.booking.server.RequestDispatcher;
import com.questrail.booking.transport.DatagramEndpoint;
import com.questrail.booking.transport.lossy.LossyDatagramEndpoint;
import com.questrail.booking.transport.udp.netty.NettyUdpDatagramEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * BookingServerRuntime
 * =============================================================================
 * Composition root and lifecycle owner of a booking server.
 *
 * <p>Wires, from the transport inward:</p>
 * <pre>
 *   UDP endpoint -> LossyDatagramEndpoint -> RequestDispatcher (worker pool)
 *                                              |-> ReplyCache
 *                                              |-> BookingEngine -> MonitorRegistry -> (push) endpoint
 * </pre>
 *
 * <p>A housekeeping thread purges expired reply-cache entries and monitor
 * subscriptions every {@link ServerConfig#purgeInterval()}.</p>
 */
public final class BookingServerRuntime
{
    private static final Logger log = LoggerFactory.getLogger(BookingServerRuntime.class);

    private final ServerConfig config;
    private final DatagramEndpoint endpoint;
    private final NettyUdpDatagramEndpoint udpEndpoint;
    private final BookingEngine engine;
    private final MonitorRegistry monitors;
    private final ReplyCache replyCache;
    private final ExecutorService workers;
    private final ScheduledExecutorService housekeeping;

    private BookingServerRuntime(ServerConfig config,
                                 DatagramEndpoint endpoint,
                                 NettyUdpDatagramEndpoint udpEndpoint,
                                 BookingEngine engine,
                                 MonitorRegistry monitors,
                                 ReplyCache replyCache,
                                 ExecutorService workers,
                                 ScheduledExecutorService housekeeping)
    {
        this.config = config;
        this.endpoint = endpoint;
        this.udpEndpoint = udpEndpoint;
        this.engine = engine;
        this.monitors = monitors;
        this.replyCache = replyCache;
        this.workers = workers;
        this.housekeeping = housekeeping;
    }

    public void start()
    {
        endpoint.start();
        long periodMillis = config.purgeInterval().toMillis();
        housekeeping.scheduleWithFixedDelay(this::purge, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        log.info("Booking server started with facilities {} (reply cache {})",
                engine.store().names(), replyCache.isEnabled() ? "enabled" : "disabled");
    }

    public void stop()
    {
        endpoint.stop();
        monitors.clear();
        shutdown(housekeeping);
        shutdown(workers);
        log.info("Booking server stopped");
    }

    /**
     * Address the UDP socket is bound to; resolves an ephemeral port after
     * {@link #start()}.
     *
     * @throws IllegalStateException when the runtime was built over a custom endpoint
     */
    public InetSocketAddress localAddress()
    {
        if (udpEndpoint == null) {
            throw new IllegalStateException("runtime was built with a custom endpoint");
        }
        return udpEndpoint.localAddress();
    }

    public BookingEngine engine()
    {
        return engine;
    }

    public MonitorRegistry monitors()
    {
        return monitors;
    }

    public ReplyCache replyCache()
    {
        return replyCache;
    }

    private void purge()
    {
        try {
            int replies = replyCache.purgeExpired();
            int subscriptions = monitors.purgeExpired();
            if (replies > 0 || subscriptions > 0) {
                log.debug("Purged {} cached replies and {} subscriptions", replies, subscriptions);
            }
        } catch (RuntimeException e) {
            log.error("Housekeeping failed", e);
        }
    }

    private static void shutdown(ExecutorService executor)
    {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ServerConfig config = ServerConfig.defaults();
        private DatagramEndpoint endpoint;
        private Random random = new Random();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;

        public Builder withConfig(ServerConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Replaces the Netty UDP endpoint; loss simulation still wraps it.
         */
        public Builder withEndpoint(DatagramEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder withRandom(Random random) {
            this.random = random;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public BookingServerRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(random, "random");
            Objects.requireNonNull(clock, "clock");

            // 1. Transport
            NettyUdpDatagramEndpoint udpEndpoint = null;
            DatagramEndpoint raw = endpoint;
            if (raw == null) {
                udpEndpoint = new NettyUdpDatagramEndpoint(config.bindAddress());
                raw = udpEndpoint;
            }
            LossyDatagramEndpoint lossy = new LossyDatagramEndpoint(raw, config.lossProfile(), random);

            // 2. Codec
            MessageEncoder encoder = new DefaultMessageEncoder();
            MessageDecoder decoder = new DefaultMessageDecoder();

            // 3. Domain
            FacilityStore store = FacilityStore.of(config.facilities());
            MonitorRegistry monitors = new MonitorRegistry(store, lossy, encoder, clock);
            BookingEngine engine = new BookingEngine(store, monitors);

            // 4. Invocation handling
            ReplyCache replyCache = config.replyCacheEnabled()
                    ? new ReplyCache(config.replyRetention(), config.replyCacheCapacity(), clock)
                    : ReplyCache.disabled(clock);
            ExecutorService workers = Executors.newFixedThreadPool(config.workerThreads(), namedThreads("booking-worker"));
            ScheduledExecutorService housekeeping =
                    Executors.newSingleThreadScheduledExecutor(namedThreads("booking-housekeeping"));

            RequestDispatcher dispatcher =
                    new RequestDispatcher(engine, monitors, lossy, decoder, encoder, replyCache, workers);
            lossy.setListener(dispatcher);

            return new BookingServerRuntime(config, lossy, udpEndpoint, engine, monitors, replyCache,
                    workers, housekeeping);
        }
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
