package com.streamfirst.tokenindex.ports;

import com.streamfirst.tokenindex.domain.Cid;
import com.streamfirst.tokenindex.domain.LedgerToken;

import java.util.List;

/**
 * Port for one node's ledger store. Only the token id and status columns are touched.
 */
public interface LedgerStorePort extends AutoCloseable {

    /** All tokens whose status is {@link com.streamfirst.tokenindex.domain.TokenStatus#PENDING}. */
    List<LedgerToken> pendingTokens();

    /**
     * Sets the status of one token.
     *
     * @return true if a row was updated
     * @throws com.streamfirst.tokenindex.domain.PersistenceException if the update fails
     */
    boolean updateStatus(Cid cid, int status);

    /** Releases the store. The default does nothing. */
    @Override
    default void close() {
    }
}
