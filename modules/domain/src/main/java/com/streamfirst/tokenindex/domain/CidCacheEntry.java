package com.streamfirst.tokenindex.domain;

import java.util.Objects;

/**
 * A cached CID with the token content it addresses. Entries are immutable once written: the same
 * content always yields the same CID, so a second write of a CID is a no-op.
 *
 * @param cid the content identifier (primary key)
 * @param content the 67-character token content
 * @param level the token level code
 * @param number the token number
 */
public record CidCacheEntry(Cid cid, String content, int level, long number) {
    public CidCacheEntry {
        Objects.requireNonNull(cid, "CID cannot be null");
        Objects.requireNonNull(content, "Content cannot be null");
    }

    /** Builds the entry for a token whose CID the network has just reported. */
    public static CidCacheEntry of(Cid cid, TokenKey key) {
        return new CidCacheEntry(
                cid, TokenContent.of(key).encoded(), key.level().code(), key.number());
    }

    /** True if {@code content} decodes to the stored level and to the hash of the stored number. */
    public boolean isConsistent() {
        try {
            TokenContent decoded = TokenContent.decode(content);
            return decoded.levelCode() == level && decoded.hash().equals(TokenHash.of(number));
        } catch (DecodeException e) {
            return false;
        }
    }
}
