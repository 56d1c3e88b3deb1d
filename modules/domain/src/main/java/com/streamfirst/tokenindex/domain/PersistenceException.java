package com.streamfirst.tokenindex.domain;

/** A durable store failed to commit or answer a query. */
public class PersistenceException extends TokenIndexException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public PersistenceException(String message) {
        super(message);
    }
}
