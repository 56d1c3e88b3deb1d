package com.streamfirst.tokenindex.application;

import java.util.List;
import lombok.NonNull;
import lombok.Value;

/** Result of re-deriving a sample of the index and comparing it with what is stored. */
@Value
public class HashIndexVerification {

    long checked;

    /** Numbers whose hash is not in the index. */
    long missing;

    /** Numbers whose hash resolves to another level or number than derivation gives. */
    long mismatched;

    /** Up to {@link HashIndexService#MAX_EXAMPLES} offending numbers. */
    @NonNull List<Long> examples;

    long indexedCount;

    long expectedCount;

    public boolean isHealthy() {
        return missing == 0 && mismatched == 0;
    }
}
