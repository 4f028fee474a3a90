package com.questrail.booking.model;

import java.util.Objects;

/**
 * One invocation of a service, tagged with its deduplication key.
 */
public record Request(RequestId id, ServiceCall call) implements WireMessage
{
    public Request {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(call, "call");
    }

    public Operation operation() {
        return call.operation();
    }
}
