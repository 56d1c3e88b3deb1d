package com.streamfirst.tokenindex.adapters;

import com.streamfirst.tokenindex.domain.HashIndexEntry;
import com.streamfirst.tokenindex.domain.PersistenceException;
import com.streamfirst.tokenindex.domain.TokenHash;
import com.streamfirst.tokenindex.domain.TokenKey;
import com.streamfirst.tokenindex.ports.HashIndexPort;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of HashIndexPort for testing and development.
 * Batches are applied under a lock so a batch is either fully visible or not at all.
 */
@Slf4j
public class InMemoryHashIndexAdapter implements HashIndexPort {

    private final Map<TokenHash, TokenKey> entries = new ConcurrentHashMap<>();

    // Number of upcoming putAll calls that fail before touching the map
    private final AtomicInteger failuresToInject = new AtomicInteger();

    @Override
    public synchronized int putAll(List<HashIndexEntry> batch) {
        if (failuresToInject.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new PersistenceException("Injected commit failure for " + batch.size() + " entries");
        }
        int inserted = 0;
        for (HashIndexEntry entry : batch) {
            if (entries.putIfAbsent(entry.hash(), entry.key()) == null) {
                inserted++;
            }
        }
        log.debug("Committed {} hash entries ({} new)", batch.size(), inserted);
        return inserted;
    }

    @Override
    public Optional<TokenKey> find(TokenHash hash) {
        return Optional.ofNullable(entries.get(hash));
    }

    @Override
    public long count() {
        return entries.size();
    }

    @Override
    public long countNumbersBetween(long start, long end) {
        return entries.values().stream()
                .filter(key -> key.number() >= start && key.number() <= end)
                .count();
    }

    @Override
    public synchronized void clear() {
        log.debug("Clearing {} hash entries", entries.size());
        entries.clear();
    }

    /**
     * Stores an arbitrary mapping, bypassing derivation. Lets tests plant inconsistent rows.
     */
    public void putRaw(TokenHash hash, TokenKey key) {
        entries.put(hash, key);
    }

    /**
     * Makes the next {@code count} calls to {@link #putAll(List)} fail.
     */
    public void failNextCommits(int count) {
        failuresToInject.set(count);
    }
}
