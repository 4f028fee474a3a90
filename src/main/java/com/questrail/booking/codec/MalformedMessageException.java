package com.questrail.booking.codec;

import com.questrail.booking.model.Operation;
import com.questrail.booking.model.RequestId;

import java.util.Optional;

/**
 * Indicates that a datagram could not be translated into a valid
 * {@link com.questrail.booking.model.WireMessage}.
 *
 * <p>When the failure happened inside a request body, after the request
 * header was read successfully, the exception carries the request id and
 * operation so the server can answer with
 * {@link com.questrail.booking.model.StatusCode#MALFORMED_REQUEST} instead of
 * leaving the client to time out.</p>
 */
public final class MalformedMessageException extends RuntimeException
{
    private final RequestId requestId;
    private final Operation operation;

    public MalformedMessageException(String message) {
        this(message, null, null, null);
    }

    public MalformedMessageException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public MalformedMessageException(String message, RequestId requestId, Operation operation, Throwable cause) {
        super(message, cause);
        this.requestId = requestId;
        this.operation = operation;
    }

    public Optional<RequestId> requestId() {
        return Optional.ofNullable(requestId);
    }

    public Optional<Operation> operation() {
        return Optional.ofNullable(operation);
    }
}
