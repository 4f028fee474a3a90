package com.questrail.booking.transport.lossy;

import com.questrail.booking.transport.DatagramEndpoint;
import com.questrail.booking.transport.DatagramEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.Random;

/**
 * LossyDatagramEndpoint
 * =============================================================================
 * {@link DatagramEndpoint} decorator that makes the network worse than it is.
 *
 * <h2>Outbound</h2>
 * Each {@link #send} is dropped with {@link LossProfile#dropProbability()}.
 * A surviving datagram is sent {@code 1 + Geometric(p_duplicate)} times back
 * to back, capped at {@link LossProfile#MAX_COPIES}.
 *
 * <h2>Inbound</h2>
 * With {@link LossProfile#dropInbound()} set, received datagrams are dropped
 * with the same probability before reaching the listener.
 *
 * <p>Payloads are never altered and datagrams are never reordered. The
 * random source is injected so tests can seed it.</p>
 */
public final class LossyDatagramEndpoint implements DatagramEndpoint, DatagramEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(LossyDatagramEndpoint.class);

    private final DatagramEndpoint delegate;
    private final LossProfile profile;
    private final Random random;

    private volatile DatagramEndpointListener listener;

    public LossyDatagramEndpoint(DatagramEndpoint delegate, LossProfile profile, Random random)
    {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.profile = Objects.requireNonNull(profile, "profile");
        this.random = Objects.requireNonNull(random, "random");
    }

    public LossProfile profile()
    {
        return profile;
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
        delegate.setListener(this);
    }

    @Override
    public void start()
    {
        if (listener == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before start()");
        }
        delegate.start();
    }

    @Override
    public void stop()
    {
        delegate.stop();
    }

    @Override
    public void send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        if (shouldDrop()) {
            log.debug("Simulated loss: dropped {}-byte datagram to {}", payload.length, remote);
            return;
        }

        int copies = copiesToSend();
        if (copies > 1) {
            log.debug("Simulated duplication: sending {} copies to {}", copies, remote);
        }
        for (int i = 0; i < copies; i++) {
            delegate.send(remote, payload);
        }
    }

    // ---------------------------------------------------------------------
    // Inbound side (this decorator is the delegate's listener)
    // ---------------------------------------------------------------------

    @Override
    public void onTransportUp()
    {
        listener.onTransportUp();
    }

    @Override
    public void onTransportDown(Throwable cause)
    {
        listener.onTransportDown(cause);
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload)
    {
        if (profile.dropInbound() && shouldDrop()) {
            log.debug("Simulated loss: dropped inbound {}-byte datagram from {}", payload.length, remote);
            return;
        }
        listener.onDatagram(remote, payload);
    }

    // ---------------------------------------------------------------------
    // Random decisions
    // ---------------------------------------------------------------------

    private boolean shouldDrop()
    {
        double p = profile.dropProbability();
        if (p <= 0.0) {
            return false;
        }
        synchronized (random) {
            return random.nextDouble() < p;
        }
    }

    private int copiesToSend()
    {
        double p = profile.duplicateProbability();
        if (p <= 0.0) {
            return 1;
        }
        int copies = 1;
        synchronized (random) {
            while (copies < LossProfile.MAX_COPIES && random.nextDouble() < p) {
                copies++;
            }
        }
        return copies;
    }
}
