package com.streamfirst.tokenindex.ports;

import com.streamfirst.tokenindex.domain.Cid;
import com.streamfirst.tokenindex.domain.CidCacheEntry;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Port for the persisted CID cache: CID to token content, level and number.
 */
public interface CidCachePort {

    /**
     * Commits a batch atomically with insert-if-absent semantics on the CID.
     *
     * @param entries the entries to write
     * @return the number of rows actually inserted
     * @throws com.streamfirst.tokenindex.domain.PersistenceException if the batch cannot be committed
     */
    int insertIfAbsent(List<CidCacheEntry> entries);

    /**
     * Looks up one CID.
     *
     * @param cid the content identifier
     * @return the cached entry, or empty if unknown
     */
    Optional<CidCacheEntry> find(Cid cid);

    /**
     * Looks up many CIDs at once. Unknown CIDs are absent from the result.
     *
     * @param cids the CIDs to resolve
     * @return the entries found, keyed by CID
     */
    Map<Cid, CidCacheEntry> findAll(Collection<Cid> cids);

    /** Total number of cached CIDs. */
    long count();
}
