package com.streamfirst.tokenindex.domain;

/** A storage-network operation failed, timed out or was refused. */
public abstract class ContentNetworkException extends TokenIndexException {

    protected ContentNetworkException(String message) {
        super(message);
    }

    protected ContentNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
