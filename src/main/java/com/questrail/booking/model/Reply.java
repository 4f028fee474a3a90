package com.questrail.booking.model;

import java.util.Objects;

/**
 * Reply
 * =============================================================================
 * Server answer to one {@link RequestId}.
 *
 * <p>The operation is echoed so that the reply body can be decoded without
 * any client-side context. A successful reply carries an operation-specific
 * {@link ReplyPayload}; every other status carries
 * {@link ReplyPayload.Failure} with a human-readable message.</p>
 */
public record Reply(RequestId id, Operation operation, StatusCode status, ReplyPayload payload) implements WireMessage
{
    public Reply {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(payload, "payload");

        boolean failurePayload = payload instanceof ReplyPayload.Failure;
        if (status.isSuccess() == failurePayload) {
            throw new IllegalArgumentException("status " + status + " does not match payload " + payload);
        }
    }

    public static Reply success(RequestId id, Operation operation, ReplyPayload payload) {
        return new Reply(id, operation, StatusCode.SUCCESS, payload);
    }

    public static Reply failure(RequestId id, Operation operation, StatusCode status, String message) {
        return new Reply(id, operation, status, new ReplyPayload.Failure(message));
    }

    public boolean isSuccess() {
        return status.isSuccess();
    }
}
