package com.streamfirst.tokenindex.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed-capacity map that evicts the least recently used entry. Reads count as use. Thread-safe.
 */
public class BoundedLruCache<K, V> {

    private final int capacity;
    private final LinkedHashMap<K, V> entries;

    public BoundedLruCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries =
                new LinkedHashMap<>(16, 0.75f, true) {
                    @Override
                    protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                        return size() > BoundedLruCache.this.capacity;
                    }
                };
    }

    public synchronized Optional<V> get(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    public synchronized void put(K key, V value) {
        entries.put(key, value);
    }

    public synchronized int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }
}
