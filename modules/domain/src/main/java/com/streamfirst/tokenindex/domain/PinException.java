package com.streamfirst.tokenindex.domain;

/** A CID could not be pinned. */
public class PinException extends ContentNetworkException {

    public PinException(String message) {
        super(message);
    }

    public PinException(String message, Throwable cause) {
        super(message, cause);
    }
}
