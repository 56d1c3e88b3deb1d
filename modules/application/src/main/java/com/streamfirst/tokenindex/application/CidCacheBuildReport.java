package com.streamfirst.tokenindex.application;

import com.streamfirst.tokenindex.domain.TokenLevel;
import java.time.Duration;
import java.util.List;
import lombok.NonNull;
import lombok.Value;

/** Outcome of one CID cache build over a range of one level. */
@Value
public class CidCacheBuildReport {

    @NonNull TokenLevel level;

    long start;

    /** Last number of the range, after clamping to the level limit. */
    long end;

    long requested;

    /** Tokens the network returned a CID for. */
    long added;

    /** Tokens skipped because the network did not return a CID. */
    long addFailures;

    /** Entries in committed batches. */
    long written;

    /** Rows that were not present before. */
    long inserted;

    /** Batches that could not be committed; rerun the covering ranges. */
    @NonNull List<BatchingWriter.FailedBatch> failedBatches;

    @NonNull Duration elapsed;

    public boolean isSuccessful() {
        return failedBatches.isEmpty();
    }

    public double tokensPerSecond() {
        double seconds = elapsed.toMillis() / 1000.0;
        return seconds > 0 ? added / seconds : added;
    }
}
