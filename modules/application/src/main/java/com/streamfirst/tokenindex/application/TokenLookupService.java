package com.streamfirst.tokenindex.application;

import com.streamfirst.tokenindex.domain.Cid;
import com.streamfirst.tokenindex.domain.CidCacheEntry;
import com.streamfirst.tokenindex.domain.RequestValidationException;
import com.streamfirst.tokenindex.ports.CidCachePort;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Read side of the CID cache. Hits are kept in a bounded in-process LRU cache; misses are not.
 * Cache entries never change once written, so nothing is ever invalidated.
 */
@Slf4j
public class TokenLookupService {

    private final CidCachePort store;
    private final BoundedLruCache<Cid, CidCacheEntry> cache;
    private final int maxBatchSize;

    public TokenLookupService(CidCachePort store, int cacheCapacity, int maxBatchSize) {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("Max batch size must be positive: " + maxBatchSize);
        }
        this.store = store;
        this.cache = new BoundedLruCache<>(cacheCapacity);
        this.maxBatchSize = maxBatchSize;
    }

    public Optional<CidCacheEntry> getOne(Cid cid) {
        Optional<CidCacheEntry> cached = cache.get(cid);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<CidCacheEntry> stored = store.find(cid);
        stored.ifPresent(entry -> cache.put(cid, entry));
        log.debug("Lookup {}: {}", cid, stored.isPresent() ? "found" : "not found");
        return stored;
    }

    /**
     * Resolves many CIDs. Duplicates are answered once; CIDs missing from the in-process cache are
     * read from the store in one call.
     *
     * @throws RequestValidationException if {@code cids} is null, longer than the maximum batch size,
     *     or contains a null, blank or whitespace-padded CID
     */
    public BatchLookupResult getBatch(List<String> cids) {
        if (cids == null) {
            throw new RequestValidationException("cids must be an array");
        }
        if (cids.size() > maxBatchSize) {
            throw new RequestValidationException(
                    "Batch size exceeds maximum of " + maxBatchSize, cids.size());
        }
        if (cids.isEmpty()) {
            return BatchLookupResult.EMPTY;
        }

        Set<Cid> unique = new LinkedHashSet<>();
        for (String raw : cids) {
            if (raw == null || raw.isBlank()) {
                throw new RequestValidationException("cids must be non-empty strings");
            }
            if (!raw.equals(raw.strip())) {
                throw new RequestValidationException("cids must not have leading or trailing whitespace");
            }
            unique.add(Cid.of(raw));
        }

        Map<Cid, CidCacheEntry> resolved = new HashMap<>();
        List<Cid> uncached = new ArrayList<>();
        for (Cid cid : unique) {
            cache.get(cid).ifPresentOrElse(entry -> resolved.put(cid, entry), () -> uncached.add(cid));
        }
        if (!uncached.isEmpty()) {
            Map<Cid, CidCacheEntry> loaded = store.findAll(uncached);
            loaded.forEach(cache::put);
            resolved.putAll(loaded);
        }

        List<CidCacheEntry> results = new ArrayList<>();
        List<String> notFound = new ArrayList<>();
        for (Cid cid : unique) {
            CidCacheEntry entry = resolved.get(cid);
            if (entry != null) {
                results.add(entry);
            } else {
                notFound.add(cid.value());
            }
        }
        log.debug(
                "Batch of {} ({} unique, {} from store): {} found",
                cids.size(),
                unique.size(),
                uncached.size(),
                results.size());
        return BatchLookupResult.of(cids.size(), results, notFound);
    }

    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    public int cachedEntries() {
        return cache.size();
    }
}
