package com.streamfirst.tokenindex.domain;

import java.util.Objects;

/**
 * One row of the reverse hash index: the hash of a token number and the token it resolves to.
 *
 * @param hash the token hash (primary key)
 * @param key the token the hash resolves to
 */
public record HashIndexEntry(TokenHash hash, TokenKey key) {
    public HashIndexEntry {
        Objects.requireNonNull(hash, "Hash cannot be null");
        Objects.requireNonNull(key, "Token key cannot be null");
    }

    /**
     * Derives the entry for a token number. The recorded level is {@link
     * TokenLevel#canonicalLevelOf(long)}, so the same number always yields the same row no matter
     * which level enumerated it.
     */
    public static HashIndexEntry derive(long number) {
        return new HashIndexEntry(
                TokenHash.of(number), new TokenKey(TokenLevel.canonicalLevelOf(number), number));
    }

    /** True if the hash is the digest of the recorded number and the number is in range. */
    public boolean isConsistent() {
        return key.isValid() && hash.equals(TokenHash.of(key.number()));
    }
}
