package com.streamfirst.tokenindex.application;

import com.streamfirst.tokenindex.domain.Cid;
import com.streamfirst.tokenindex.domain.RejectionReason;
import com.streamfirst.tokenindex.domain.TokenKey;
import java.util.Objects;

/**
 * What validation decided for one ledger token.
 *
 * @param cid the token
 * @param outcome the decision
 * @param reason why the token was rejected; null unless rejected
 * @param key the resolved token, when decoding and lookup got that far
 * @param detail human readable explanation for logs and reports
 */
public record TokenVerdict(
        Cid cid, Outcome outcome, RejectionReason reason, TokenKey key, String detail) {

    public enum Outcome {
        /** Valid and pinned (or would be, in a dry run). */
        ADMITTED,
        /** Invalid; moved to the rejected status (unless dry run). */
        REJECTED,
        /** Valid or undecided but an operation failed; the token stays pending. */
        ERROR
    }

    public TokenVerdict {
        Objects.requireNonNull(cid, "cid");
        Objects.requireNonNull(outcome, "outcome");
        if ((outcome == Outcome.REJECTED) != (reason != null)) {
            throw new IllegalArgumentException("A reason is required exactly for rejections");
        }
    }

    static TokenVerdict admitted(Cid cid, TokenKey key) {
        return new TokenVerdict(cid, Outcome.ADMITTED, null, key, "admitted as " + key);
    }

    static TokenVerdict rejected(Cid cid, RejectionReason reason, TokenKey key, String detail) {
        return new TokenVerdict(cid, Outcome.REJECTED, reason, key, detail);
    }

    static TokenVerdict error(Cid cid, TokenKey key, String detail) {
        return new TokenVerdict(cid, Outcome.ERROR, null, key, detail);
    }
}
