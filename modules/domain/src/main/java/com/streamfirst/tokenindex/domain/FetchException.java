package com.streamfirst.tokenindex.domain;

/** Content could not be fetched by CID. */
public class FetchException extends ContentNetworkException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
