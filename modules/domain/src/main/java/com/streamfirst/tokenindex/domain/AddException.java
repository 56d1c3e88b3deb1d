package com.streamfirst.tokenindex.domain;

/** Content could not be added (or hashed) by the network. */
public class AddException extends ContentNetworkException {

    public AddException(String message) {
        super(message);
    }

    public AddException(String message, Throwable cause) {
        super(message, cause);
    }
}
