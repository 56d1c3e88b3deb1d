package com.streamfirst.tokenindex.domain;

import java.util.Objects;

/**
 * A token record as held by a node's ledger store.
 *
 * @param cid the token's content identifier (the ledger's token id)
 * @param status the current {@code token_status}
 */
public record LedgerToken(Cid cid, int status) {
    public LedgerToken {
        Objects.requireNonNull(cid, "CID cannot be null");
    }

    public static LedgerToken pending(Cid cid) {
        return new LedgerToken(cid, TokenStatus.PENDING);
    }

    public boolean isPending() {
        return TokenStatus.isPending(status);
    }
}
