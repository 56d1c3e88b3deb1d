package com.streamfirst.tokenindex.adapters;

import com.streamfirst.tokenindex.domain.Cid;
import com.streamfirst.tokenindex.domain.CidCacheEntry;
import com.streamfirst.tokenindex.domain.PersistenceException;
import com.streamfirst.tokenindex.ports.CidCachePort;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * In-memory implementation of CidCachePort for testing and development.
 * Counts reads so tests can tell whether a lookup reached the store.
 */
@Slf4j
public class InMemoryCidCacheAdapter implements CidCachePort {

    private final Map<Cid, CidCacheEntry> entries = new ConcurrentHashMap<>();

    private final AtomicLong storeReads = new AtomicLong();

    private volatile Predicate<CidCacheEntry> commitFailure = entry -> false;

    @Override
    public synchronized int insertIfAbsent(List<CidCacheEntry> batch) {
        for (CidCacheEntry entry : batch) {
            if (commitFailure.test(entry)) {
                log.debug("Rejecting batch of {} entries, contains {}", batch.size(), entry.cid());
                throw new PersistenceException("Injected commit failure at token " + entry.number());
            }
        }
        int inserted = 0;
        for (CidCacheEntry entry : batch) {
            if (entries.putIfAbsent(entry.cid(), entry) == null) {
                inserted++;
            }
        }
        log.debug("Committed {} cache entries ({} new)", batch.size(), inserted);
        return inserted;
    }

    @Override
    public Optional<CidCacheEntry> find(Cid cid) {
        storeReads.incrementAndGet();
        return Optional.ofNullable(entries.get(cid));
    }

    @Override
    public Map<Cid, CidCacheEntry> findAll(Collection<Cid> cids) {
        storeReads.incrementAndGet();
        Map<Cid, CidCacheEntry> found = new HashMap<>();
        for (Cid cid : cids) {
            CidCacheEntry entry = entries.get(cid);
            if (entry != null) {
                found.put(cid, entry);
            }
        }
        return found;
    }

    @Override
    public long count() {
        return entries.size();
    }

    /**
     * Makes every batch that contains a matching entry fail without writing anything.
     */
    public void failCommitsContaining(Predicate<CidCacheEntry> matcher) {
        this.commitFailure = Objects.requireNonNull(matcher);
    }

    /** Number of find/findAll calls served so far. */
    public long getStoreReads() {
        return storeReads.get();
    }

    public Collection<CidCacheEntry> getAllEntries() {
        return List.copyOf(entries.values());
    }
}
