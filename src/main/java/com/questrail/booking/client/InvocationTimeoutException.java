package com.questrail.booking.client;

import com.questrail.booking.model.RequestId;

import java.time.Duration;
import java.util.Objects;

/**
 * No reply arrived for a request after its last retransmission.
 *
 * <p>The request may or may not have been executed by the server; for a
 * non-idempotent operation the caller can inspect server state (for example
 * with a booking lookup) before retrying under a new request id.</p>
 */
public final class InvocationTimeoutException extends RuntimeException
{
    private final RequestId requestId;
    private final int attempts;
    private final Duration elapsed;

    public InvocationTimeoutException(RequestId requestId, int attempts, Duration elapsed)
    {
        super("No reply to " + Objects.requireNonNull(requestId, "requestId")
                + " after " + attempts + " attempts (" + elapsed.toMillis() + " ms)");
        this.requestId = requestId;
        this.attempts = attempts;
        this.elapsed = elapsed;
    }

    public RequestId requestId()
    {
        return requestId;
    }

    public int attempts()
    {
        return attempts;
    }

    public Duration elapsed()
    {
        return elapsed;
    }
}
