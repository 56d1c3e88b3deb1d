package com.streamfirst.tokenindex.domain;

/** Why a pending token was rejected. Every reason leads to {@link TokenStatus#REJECTED}. */
public enum RejectionReason {
    /** Content could not be fetched from the storage network. */
    FETCH_FAILED,
    /** Fetched content is not three digits followed by 64 hex characters. */
    DECODE_FAILED,
    /** The hash is not in the reverse index. */
    HASH_NOT_INDEXED,
    /** The level code names no level, or the number exceeds the level's limit. */
    OUT_OF_RANGE,
    /** Re-adding the canonical content produced a different CID than the one reported. */
    CONTENT_MISMATCH
}
