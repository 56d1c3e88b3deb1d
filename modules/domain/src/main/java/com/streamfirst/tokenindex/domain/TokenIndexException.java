package com.streamfirst.tokenindex.domain;

/**
 * Root of the token index error taxonomy. All subclasses are unchecked; per-item failures are
 * caught by the pipelines that own the item, everything else propagates to the caller.
 */
public class TokenIndexException extends RuntimeException {

    public TokenIndexException(String message) {
        super(message);
    }

    public TokenIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
