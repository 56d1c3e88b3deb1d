package com.streamfirst.tokenindex.domain;

/** The storage-network endpoint of a node cannot be determined. */
public class EndpointException extends ContentNetworkException {

    public EndpointException(String message) {
        super(message);
    }

    public EndpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
