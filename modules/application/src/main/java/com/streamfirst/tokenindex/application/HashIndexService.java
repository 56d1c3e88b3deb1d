package com.streamfirst.tokenindex.application;

import com.streamfirst.tokenindex.domain.HashIndexEntry;
import com.streamfirst.tokenindex.domain.TokenHash;
import com.streamfirst.tokenindex.domain.TokenKey;
import com.streamfirst.tokenindex.domain.TokenLevel;
import com.streamfirst.tokenindex.ports.HashIndexPort;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.PrimitiveIterator;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.LongStream;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds, verifies and queries the reverse hash index.
 *
 * <p>Level ranges all start at 1, so the numbers of a set of levels are exactly {@code [1, max
 * limit]}. Each number is hashed once and recorded under its canonical level. Hashing runs on a
 * worker pool in fixed-size chunks; all writes go through one {@link BatchingWriter}.
 *
 * <p>Builds are resumable: a chunk whose numbers are all present is skipped, and writes are
 * insert-if-absent.
 */
@Slf4j
public class HashIndexService {

    static final int CHUNK_SIZE = 50_000;
    static final int MAX_EXAMPLES = 20;
    static final long SAMPLE_SEED = 20_240_101L;

    private final HashIndexPort index;
    private final int batchSize;
    private final int workers;

    public HashIndexService(HashIndexPort index, int batchSize, int workers) {
        if (batchSize < 1 || workers < 1) {
            throw new IllegalArgumentException("Batch size and workers must be positive");
        }
        this.index = index;
        this.batchSize = batchSize;
        this.workers = workers;
    }

    /**
     * Indexes every number of the given levels.
     *
     * @param levels levels to cover; empty means all four
     * @param force clear the index first instead of resuming
     */
    public HashIndexBuildReport build(Set<TokenLevel> levels, boolean force) {
        Set<TokenLevel> requested =
                levels.isEmpty() ? EnumSet.allOf(TokenLevel.class) : EnumSet.copyOf(levels);
        Instant started = Instant.now();

        if (force) {
            log.info("Clearing hash index before rebuild");
            index.clear();
        }

        Set<TokenLevel> toBuild = EnumSet.noneOf(TokenLevel.class);
        Set<TokenLevel> skipped = EnumSet.noneOf(TokenLevel.class);
        for (TokenLevel level : requested) {
            long present = index.countNumbersBetween(1, level.limit());
            if (present >= level.limit()) {
                log.info("Level {} already complete ({} numbers), skipping", level, present);
                skipped.add(level);
            } else {
                log.info("Level {} has {} of {} numbers indexed", level, present, level.limit());
                toBuild.add(level);
            }
        }
        if (toBuild.isEmpty()) {
            return new HashIndexBuildReport(
                    toBuild, skipped, 0, 0, 0, List.of(), Duration.between(started, Instant.now()));
        }

        long end = toBuild.stream().mapToLong(TokenLevel::limit).max().orElseThrow();
        RangeResult result = indexRange(1, end);
        HashIndexBuildReport report =
                new HashIndexBuildReport(
                        toBuild,
                        skipped,
                        result.hashed,
                        result.writer.written(),
                        result.writer.inserted(),
                        result.writer.failedBatches(),
                        Duration.between(started, Instant.now()));
        log.info(
                "Hash index build of {} done: {} hashed, {} new rows, {} failed batches in {}",
                toBuild,
                report.getHashed(),
                report.getInserted(),
                report.getFailedBatches().size(),
                report.getElapsed());
        return report;
    }

    /**
     * Indexes {@code [start, end]} of one level. {@code end} is clamped to the level limit.
     *
     * @throws IllegalArgumentException if {@code start < 1} or {@code start > end}
     */
    public HashIndexBuildReport buildRange(TokenLevel level, long start, long end) {
        long clampedEnd = Math.min(end, level.limit());
        if (start < 1 || start > clampedEnd) {
            throw new IllegalArgumentException(
                    "Invalid range " + start + ".." + end + " for level " + level + " (limit " + level.limit() + ")");
        }
        Instant started = Instant.now();
        RangeResult result = indexRange(start, clampedEnd);
        return new HashIndexBuildReport(
                EnumSet.of(level),
                EnumSet.noneOf(TokenLevel.class),
                result.hashed,
                result.writer.written(),
                result.writer.inserted(),
                result.writer.failedBatches(),
                Duration.between(started, Instant.now()));
    }

    /** Resolves a hash to its token. */
    public Optional<TokenKey> lookup(TokenHash hash) {
        return index.find(hash);
    }

    /**
     * Re-derives a deterministic sample and compares it with the index. The sample holds the first
     * and last number of every level plus {@code sampleSize} seeded random numbers; {@code sampleSize
     * <= 0} checks every number. Never writes.
     */
    public HashIndexVerification verify(int sampleSize) {
        long max = TokenLevel.maxLimit();
        if (sampleSize <= 0) {
            log.info("Verifying all {} numbers", max);
        }
        LongStream numbers = numbersToVerify(sampleSize);

        long checked = 0;
        long missing = 0;
        long mismatched = 0;
        List<Long> examples = new ArrayList<>();
        PrimitiveIterator.OfLong it = numbers.iterator();
        while (it.hasNext()) {
            long number = it.nextLong();
            checked++;
            HashIndexEntry expected = HashIndexEntry.derive(number);
            Optional<TokenKey> stored = index.find(expected.hash());
            if (stored.isEmpty()) {
                missing++;
            } else if (!stored.get().equals(expected.key())) {
                mismatched++;
                log.warn("Hash of {} resolves to {} instead of {}", number, stored.get(), expected.key());
            } else {
                continue;
            }
            if (examples.size() < MAX_EXAMPLES) {
                examples.add(number);
            }
        }
        HashIndexVerification verification =
                new HashIndexVerification(checked, missing, mismatched, examples, index.count(), max);
        log.info(
                "Verified {} numbers: {} missing, {} mismatched, {} of {} rows indexed",
                checked,
                missing,
                mismatched,
                verification.getIndexedCount(),
                max);
        return verification;
    }

    /** Level bounds plus {@code sampleSize} seeded random numbers, or every number if not positive. */
    static LongStream numbersToVerify(int sampleSize) {
        long max = TokenLevel.maxLimit();
        if (sampleSize <= 0) {
            return LongStream.rangeClosed(1, max);
        }
        Random random = new Random(SAMPLE_SEED);
        LongStream bounds =
                Arrays.stream(TokenLevel.values()).flatMapToLong(level -> LongStream.of(1, level.limit()));
        LongStream sample =
                LongStream.generate(() -> 1 + (long) (random.nextDouble() * max)).limit(sampleSize);
        return LongStream.concat(bounds, sample).distinct().sorted();
    }

    private RangeResult indexRange(long start, long end) {
        BatchingWriter<HashIndexEntry> writer =
                new BatchingWriter<HashIndexEntry>(
                                "hash-index",
                                Math.max(batchSize * 2, CHUNK_SIZE),
                                batchSize,
                                Duration.ofSeconds(1),
                                index::putAll,
                                entry -> entry.key().number())
                        .start();
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        long hashed = 0;
        BatchingWriter.Result written = null;
        try {
            List<Future<Long>> chunks = new ArrayList<>();
            for (long from = start; from <= end; from += CHUNK_SIZE) {
                long chunkStart = from;
                long chunkEnd = Math.min(end, from + CHUNK_SIZE - 1);
                chunks.add(pool.submit(() -> hashChunk(chunkStart, chunkEnd, writer)));
            }
            for (Future<Long> chunk : chunks) {
                hashed += chunk.get();
            }
            written = writer.finish();
            return new RangeResult(hashed, written);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Hash index build interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Hash worker failed", e.getCause());
        } finally {
            pool.shutdownNow();
            if (written == null) {
                writer.abort();
            }
        }
    }

    private long hashChunk(long from, long to, BatchingWriter<HashIndexEntry> writer)
            throws InterruptedException {
        long size = to - from + 1;
        if (index.countNumbersBetween(from, to) >= size) {
            log.debug("Numbers {}..{} already indexed", from, to);
            return 0;
        }
        for (long n = from; n <= to; n++) {
            writer.put(HashIndexEntry.derive(n));
        }
        log.debug("Hashed numbers {}..{}", from, to);
        return size;
    }

    private record RangeResult(long hashed, BatchingWriter.Result writer) {}
}
