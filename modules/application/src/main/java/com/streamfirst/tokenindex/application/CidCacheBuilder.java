package com.streamfirst.tokenindex.application;

import com.streamfirst.tokenindex.domain.AddException;
import com.streamfirst.tokenindex.domain.Cid;
import com.streamfirst.tokenindex.domain.CidCacheEntry;
import com.streamfirst.tokenindex.domain.TokenContent;
import com.streamfirst.tokenindex.domain.TokenKey;
import com.streamfirst.tokenindex.domain.TokenLevel;
import com.streamfirst.tokenindex.ports.CidCachePort;
import com.streamfirst.tokenindex.ports.ContentNetworkPort;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Precomputes the CID of every token in a range and persists it with the token content.
 *
 * <p>Producers each own a contiguous slice of the range. Per number they derive the content, ask
 * the network for its CID and hand the entry to the single {@link BatchingWriter}; they never touch
 * persistence. A token whose add fails is skipped and counted.
 */
@Slf4j
public class CidCacheBuilder {

    static final Duration IDLE_FLUSH = Duration.ofSeconds(1);
    static final Duration PROGRESS_INTERVAL = Duration.ofSeconds(5);

    private final ContentNetworkPort network;
    private final CidCachePort cache;
    private final int queueCapacity;
    private final boolean onlyHash;

    /**
     * @param onlyHash ask the network for the CID without storing the content
     */
    public CidCacheBuilder(
            ContentNetworkPort network, CidCachePort cache, int queueCapacity, boolean onlyHash) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + queueCapacity);
        }
        this.network = network;
        this.cache = cache;
        this.queueCapacity = queueCapacity;
        this.onlyHash = onlyHash;
    }

    /** Default worker count: one less than the available processors, at least one. */
    public static int defaultWorkers() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    /**
     * Builds the cache for {@code [start, end]} of {@code level}. {@code end} is clamped to the level
     * limit.
     *
     * @throws IllegalArgumentException if {@code start < 1}, {@code start > end} after clamping, or
     *     the worker count or batch size is not positive
     */
    public CidCacheBuildReport build(
            TokenLevel level, long start, long end, int workerCount, int batchSize) {
        long clampedEnd = Math.min(end, level.limit());
        if (start < 1 || start > clampedEnd) {
            throw new IllegalArgumentException(
                    "Invalid range " + start + ".." + end + " for level " + level + " (limit " + level.limit() + ")");
        }
        if (workerCount < 1 || batchSize < 1) {
            throw new IllegalArgumentException("Worker count and batch size must be positive");
        }
        if (clampedEnd < end) {
            log.info("End {} clamped to level {} limit {}", end, level, clampedEnd);
        }
        long requested = clampedEnd - start + 1;
        int workers = (int) Math.min(workerCount, requested);
        log.info(
                "Building CID cache for {} numbers {}..{} with {} workers, batch size {} via {}",
                level,
                start,
                clampedEnd,
                workers,
                batchSize,
                network.endpoint());

        Instant started = Instant.now();
        AtomicLong added = new AtomicLong();
        AtomicLong addFailures = new AtomicLong();
        BatchingWriter<CidCacheEntry> writer =
                new BatchingWriter<CidCacheEntry>(
                                "cid-cache",
                                queueCapacity,
                                batchSize,
                                IDLE_FLUSH,
                                cache::insertIfAbsent,
                                CidCacheEntry::number)
                        .start();

        ScheduledExecutorService progress = Executors.newSingleThreadScheduledExecutor();
        progress.scheduleAtFixedRate(
                () -> logProgress(requested, added.get(), addFailures.get(), writer, started),
                PROGRESS_INTERVAL.toMillis(),
                PROGRESS_INTERVAL.toMillis(),
                TimeUnit.MILLISECONDS);
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        BatchingWriter.Result written = null;
        try {
            List<Future<?>> slices = new ArrayList<>();
            long sliceSize = (requested + workers - 1) / workers;
            for (long from = start; from <= clampedEnd; from += sliceSize) {
                long sliceStart = from;
                long sliceEnd = Math.min(clampedEnd, from + sliceSize - 1);
                slices.add(
                        pool.submit(
                                () -> {
                                    produce(level, sliceStart, sliceEnd, writer, added, addFailures);
                                    return null;
                                }));
            }
            for (Future<?> slice : slices) {
                slice.get();
            }
            written = writer.finish();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("CID cache build interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("CID cache worker failed", e.getCause());
        } finally {
            pool.shutdownNow();
            progress.shutdownNow();
            if (written == null) {
                writer.abort();
            }
        }

        CidCacheBuildReport report =
                new CidCacheBuildReport(
                        level,
                        start,
                        clampedEnd,
                        requested,
                        added.get(),
                        addFailures.get(),
                        written.written(),
                        written.inserted(),
                        written.failedBatches(),
                        Duration.between(started, Instant.now()));
        log.info(
                "CID cache build for {} {}..{} done: {} added, {} add failures, {} written ({} new), {} failed batches in {} ({} tokens/s)",
                level,
                start,
                clampedEnd,
                report.getAdded(),
                report.getAddFailures(),
                report.getWritten(),
                report.getInserted(),
                report.getFailedBatches().size(),
                report.getElapsed(),
                String.format("%.1f", report.tokensPerSecond()));
        return report;
    }

    private void produce(
            TokenLevel level,
            long from,
            long to,
            BatchingWriter<CidCacheEntry> writer,
            AtomicLong added,
            AtomicLong addFailures)
            throws InterruptedException {
        for (long n = from; n <= to; n++) {
            TokenKey key = new TokenKey(level, n);
            String content = TokenContent.of(key).encoded();
            Cid cid;
            try {
                cid = network.add(content, onlyHash);
            } catch (AddException e) {
                addFailures.incrementAndGet();
                log.warn("Skipping {}: {}", key, e.getMessage());
                continue;
            }
            added.incrementAndGet();
            writer.put(CidCacheEntry.of(cid, key));
        }
        log.debug("Slice {}..{} of {} done", from, to, level);
    }

    private static void logProgress(
            long requested, long added, long failures, BatchingWriter<?> writer, Instant started) {
        double seconds = Math.max(1, Duration.between(started, Instant.now()).toSeconds());
        log.info(
                "Progress: {}/{} added, {} failed, {} written, {} queued ({} tokens/s)",
                added,
                requested,
                failures,
                writer.writtenSoFar(),
                writer.queued(),
                String.format("%.1f", added / seconds));
    }
}
