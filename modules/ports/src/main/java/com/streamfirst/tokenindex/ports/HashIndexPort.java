package com.streamfirst.tokenindex.ports;

import com.streamfirst.tokenindex.domain.HashIndexEntry;
import com.streamfirst.tokenindex.domain.TokenHash;
import com.streamfirst.tokenindex.domain.TokenKey;

import java.util.List;
import java.util.Optional;

/**
 * Port for the reverse hash index: token hash to (level, number).
 * The index is keyed by hash and is written once per number; later writes of the same hash are ignored.
 */
public interface HashIndexPort {

    /**
     * Persists a batch atomically. Entries whose hash is already present are skipped.
     *
     * @param entries the entries to write
     * @return the number of rows actually inserted
     * @throws com.streamfirst.tokenindex.domain.PersistenceException if the batch cannot be committed;
     *         no entry of the batch is then visible
     */
    int putAll(List<HashIndexEntry> entries);

    /**
     * Point lookup by primary key.
     *
     * @param hash the token hash
     * @return the token the hash resolves to, or empty if it is not indexed
     */
    Optional<TokenKey> find(TokenHash hash);

    /** Total number of indexed hashes. */
    long count();

    /**
     * Counts indexed numbers in {@code [start, end]}, whatever level they are recorded under.
     * Used to decide whether a range is already complete.
     */
    long countNumbersBetween(long start, long end);

    /** Removes every entry. */
    void clear();
}
