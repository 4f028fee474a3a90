package com.questrail.booking.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Retransmission policy for one client invocation.
 *
 * <p>A request is sent once and then retransmitted, byte for byte, each time
 * {@code timeout} elapses without a matching reply, at most {@code maxRetries}
 * times. The call fails with {@link InvocationTimeoutException} when the last
 * timer fires.</p>
 *
 * @param timeout    wait per attempt; must be positive
 * @param maxRetries retransmissions after the first send; {@code >= 0}
 */
public record InvocationPolicy(Duration timeout, int maxRetries)
{
    public InvocationPolicy {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
    }

    public static InvocationPolicy defaults() {
        return new InvocationPolicy(Duration.ofMillis(500), 10);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Longest a client keeps retransmitting one request.
     */
    public Duration worstCaseDuration() {
        return timeout.multipliedBy(maxAttempts());
    }
}
