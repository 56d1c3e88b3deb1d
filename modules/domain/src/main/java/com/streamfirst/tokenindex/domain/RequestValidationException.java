package com.streamfirst.tokenindex.domain;

import java.util.OptionalInt;

/** A lookup request is malformed or too large. Maps to a client error, never to a 5xx. */
public class RequestValidationException extends TokenIndexException {

    private final Integer received;

    public RequestValidationException(String message) {
        super(message);
        this.received = null;
    }

    /**
     * @param received number of items the oversized request carried
     */
    public RequestValidationException(String message, int received) {
        super(message);
        this.received = received;
    }

    /** Number of items received, when the request was rejected for its size. */
    public OptionalInt getReceived() {
        return received == null ? OptionalInt.empty() : OptionalInt.of(received);
    }
}
