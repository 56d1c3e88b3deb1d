package com.streamfirst.tokenindex.domain;

/** Token content does not match the fixed level-code plus hash layout. */
public class DecodeException extends TokenIndexException {

    private final String content;

    public DecodeException(String message, String content) {
        super(message);
        this.content = content;
    }

    /** The offending input, possibly null. */
    public String getContent() {
        return content;
    }
}
