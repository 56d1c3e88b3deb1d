package com.streamfirst.tokenindex.ports;

import com.streamfirst.tokenindex.domain.Cid;

/**
 * Port for the content-addressed storage network.
 *
 * <p>An instance is bound to one network endpoint. Validation runs obtain one per node through
 * {@link ContentNetworkFactory}; no operation depends on process-wide state.
 *
 * <p>An operation whose calling thread is interrupted throws
 * {@link com.streamfirst.tokenindex.domain.OperationInterruptedException} rather than one of the
 * failure exceptions below.
 */
public interface ContentNetworkPort {

    /**
     * Retrieves the content addressed by a CID as UTF-8 text.
     *
     * @throws com.streamfirst.tokenindex.domain.FetchException on timeout, missing content or
     *         an unreachable endpoint
     */
    String fetch(Cid cid);

    /**
     * Adds content to the network and returns its CID.
     *
     * @param content the text to add
     * @param onlyHash compute the CID without storing or pinning the content
     * @throws com.streamfirst.tokenindex.domain.AddException if the network does not return a CID
     */
    Cid add(String content, boolean onlyHash);

    /**
     * Pins a CID on the bound node. Pinning an already pinned CID succeeds.
     *
     * @throws com.streamfirst.tokenindex.domain.PinException if the pin is refused or times out
     */
    void pin(Cid cid);

    /** True if the CID is recursively pinned on the bound node. */
    boolean isPinned(Cid cid);

    /** Human readable description of the bound endpoint, for logs. */
    String endpoint();
}
