package com.streamfirst.tokenindex.application;

import com.streamfirst.tokenindex.domain.TokenLevel;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import lombok.NonNull;
import lombok.Value;

/** Outcome of one hash index build or range build. */
@Value
public class HashIndexBuildReport {

    /** Levels whose numbers were enumerated by this run. */
    @NonNull Set<TokenLevel> builtLevels;

    /** Levels skipped because every number was already indexed. */
    @NonNull Set<TokenLevel> skippedLevels;

    /** Numbers hashed and handed to the writer. */
    long hashed;

    /** Entries in committed batches. */
    long written;

    /** Rows that were not present before. */
    long inserted;

    /** Batches that could not be committed. */
    @NonNull List<BatchingWriter.FailedBatch> failedBatches;

    @NonNull Duration elapsed;

    public boolean isSuccessful() {
        return failedBatches.isEmpty();
    }
}
