package com.streamfirst.tokenindex.domain;

/**
 * Values of the ledger's {@code token_status} column that this system reads or writes.
 *
 * <p>Only the pending and rejected values are fixed. The value an admitted token moves to is a
 * ledger convention and comes from configuration.
 */
public final class TokenStatus {

    /** Reported by the node, not yet validated. */
    public static final int PENDING = 0;

    /** Failed validation. Terminal: nothing moves a token out of this state. */
    public static final int REJECTED = 2302;

    private TokenStatus() {}

    public static boolean isPending(int status) {
        return status == PENDING;
    }

    public static boolean isRejected(int status) {
        return status == REJECTED;
    }
}
