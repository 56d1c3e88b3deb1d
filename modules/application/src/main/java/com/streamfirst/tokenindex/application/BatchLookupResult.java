package com.streamfirst.tokenindex.application;

import com.streamfirst.tokenindex.domain.CidCacheEntry;
import java.util.List;

/**
 * Answer to a batch lookup.
 *
 * @param results entries found, in order of first occurrence in the request
 * @param notFound requested CIDs with no entry, in order of first occurrence
 * @param totalRequested size of the request as sent, duplicates included
 * @param totalFound size of {@code results}
 * @param totalNotFound size of {@code notFound}
 */
public record BatchLookupResult(
        List<CidCacheEntry> results,
        List<String> notFound,
        int totalRequested,
        int totalFound,
        int totalNotFound) {

    static final BatchLookupResult EMPTY = new BatchLookupResult(List.of(), List.of(), 0, 0, 0);

    static BatchLookupResult of(int totalRequested, List<CidCacheEntry> results, List<String> notFound) {
        return new BatchLookupResult(
                List.copyOf(results), List.copyOf(notFound), totalRequested, results.size(), notFound.size());
    }
}
