package com.streamfirst.tokenindex.domain;

/**
 * The calling thread was interrupted while waiting on an external system. The thread's interrupt
 * flag is set again before this is thrown.
 */
public class OperationInterruptedException extends TokenIndexException {

    public OperationInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }

    public OperationInterruptedException(String message) {
        super(message);
    }
}
