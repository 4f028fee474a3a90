package com.questrail.booking.runtime;

import com.questrail.booking.client.BookingClient;
import com.questrail.booking.client.ClientInvocationManager;
import com.questrail.booking.codec.impl.DefaultMessageDecoder;
import com.questrail.booking.codec.impl.DefaultMessageEncoder;
import com.questrail.booking.config.ClientConfig;
import com.questrail.booking.internal.time.MonotonicScheduler;
import com.questrail.booking.internal.time.ScheduledExecutorScheduler;
import com.questrail.booking.internal.time.SystemMonotonicClock;
import com.questrail.booking.transport.DatagramEndpoint;
import com.questrail.booking.transport.lossy.LossyDatagramEndpoint;
import com.questrail.booking.transport.udp.netty.NettyUdpDatagramEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Composition root and lifecycle owner of one booking client: UDP endpoint,
 * loss simulation, single timer thread, invocation manager and
 * {@link BookingClient} facade.
 */
public final class BookingClientRuntime
{
    private static final Logger log = LoggerFactory.getLogger(BookingClientRuntime.class);

    private final ClientConfig config;
    private final DatagramEndpoint endpoint;
    private final ScheduledExecutorService timerExecutor;
    private final ClientInvocationManager invocations;
    private final BookingClient client;

    private BookingClientRuntime(ClientConfig config,
                                 DatagramEndpoint endpoint,
                                 ScheduledExecutorService timerExecutor,
                                 ClientInvocationManager invocations)
    {
        this.config = config;
        this.endpoint = endpoint;
        this.timerExecutor = timerExecutor;
        this.invocations = invocations;
        this.client = new BookingClient(invocations);
    }

    public void start()
    {
        endpoint.start();
        log.info("Booking client {} talking to {}", config.clientId(), config.serverAddress());
    }

    public void stop()
    {
        invocations.close();
        endpoint.stop();
        timerExecutor.shutdown();
        try {
            if (!timerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                timerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            timerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public BookingClient client()
    {
        return client;
    }

    public ClientInvocationManager invocations()
    {
        return invocations;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ClientConfig config = ClientConfig.builder().build();
        private DatagramEndpoint endpoint;
        private Random random = new Random();

        public Builder withConfig(ClientConfig config) {
            this.config = config;
            return this;
        }

        public Builder withEndpoint(DatagramEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder withRandom(Random random) {
            this.random = random;
            return this;
        }

        public BookingClientRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(random, "random");

            DatagramEndpoint raw = endpoint != null ? endpoint : new NettyUdpDatagramEndpoint(config.bindAddress());
            LossyDatagramEndpoint lossy = new LossyDatagramEndpoint(raw, config.lossProfile(), random);

            ScheduledExecutorService timerExecutor =
                    Executors.newSingleThreadScheduledExecutor(BookingServerRuntime.namedThreads("booking-client-timer"));
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(timerExecutor, SystemMonotonicClock.INSTANCE);

            ClientInvocationManager invocations = new ClientInvocationManager(
                    config.clientId(),
                    config.serverAddress(),
                    lossy,
                    new DefaultMessageEncoder(),
                    new DefaultMessageDecoder(),
                    scheduler,
                    config.invocationPolicy());
            lossy.setListener(invocations);

            return new BookingClientRuntime(config, lossy, timerExecutor, invocations);
        }
    }
}
