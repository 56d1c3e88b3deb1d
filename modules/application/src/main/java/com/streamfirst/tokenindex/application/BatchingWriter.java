package com.streamfirst.tokenindex.application;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.ToLongFunction;
import lombok.extern.slf4j.Slf4j;

/**
 * Single-consumer side of a producer/consumer pipeline. Any number of producers {@link #put} items
 * onto a bounded queue; exactly one writer thread drains it into batches and hands each batch to a
 * {@link BatchSink}.
 *
 * <p>A batch is committed when it reaches the batch size, when the queue has been idle for the
 * idle-flush interval, and at {@link #finish()}. A batch whose commit throws is not retried: its
 * key span is recorded as a {@link FailedBatch} and the writer carries on with the next batch.
 *
 * @param <T> item type
 */
@Slf4j
public class BatchingWriter<T> {

    /** Commits one batch and returns how many of its items were new. */
    @FunctionalInterface
    public interface BatchSink<T> {
        int commit(List<T> batch);
    }

    /**
     * A batch that could not be committed.
     *
     * @param size number of items in the batch
     * @param firstKey smallest key in the batch
     * @param lastKey largest key in the batch
     * @param error message of the commit failure
     */
    public record FailedBatch(int size, long firstKey, long lastKey, String error) {}

    /** Totals of a finished writer. */
    public record Result(long written, long inserted, List<FailedBatch> failedBatches) {
        public boolean hasFailures() {
            return !failedBatches.isEmpty();
        }
    }

    private static final Object END = new Object();
    private static final Duration ABORT_WAIT = Duration.ofSeconds(10);

    private final String name;
    private final int batchSize;
    private final Duration idleFlush;
    private final BatchSink<T> sink;
    private final ToLongFunction<T> keyOf;
    private final BlockingQueue<Object> queue;
    private final Thread thread;

    private final AtomicLong written = new AtomicLong();
    private final AtomicLong inserted = new AtomicLong();
    private final List<FailedBatch> failedBatches = new CopyOnWriteArrayList<>();

    public BatchingWriter(
            String name,
            int queueCapacity,
            int batchSize,
            Duration idleFlush,
            BatchSink<T> sink,
            ToLongFunction<T> keyOf) {
        if (queueCapacity < 1 || batchSize < 1) {
            throw new IllegalArgumentException("Queue capacity and batch size must be positive");
        }
        this.name = name;
        this.batchSize = batchSize;
        this.idleFlush = Objects.requireNonNull(idleFlush);
        this.sink = Objects.requireNonNull(sink);
        this.keyOf = Objects.requireNonNull(keyOf);
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.thread = new Thread(this::drain, name + "-writer");
        this.thread.setDaemon(true);
    }

    /** Starts the writer thread. Returns this writer. */
    public BatchingWriter<T> start() {
        thread.start();
        log.debug("{} writer started (batch size {})", name, batchSize);
        return this;
    }

    /** Enqueues one item, blocking while the queue is full. */
    public void put(T item) throws InterruptedException {
        queue.put(Objects.requireNonNull(item));
    }

    /** Items in successfully committed batches so far. */
    public long writtenSoFar() {
        return written.get();
    }

    public int queued() {
        return queue.size();
    }

    /**
     * Signals end of input, waits for the writer to commit what is left and returns the totals. Call
     * once, after every producer has finished.
     */
    public Result finish() throws InterruptedException {
        queue.put(END);
        thread.join();
        log.debug("{} writer finished: {} written, {} new", name, written.get(), inserted.get());
        return new Result(written.get(), inserted.get(), List.copyOf(failedBatches));
    }

    /**
     * Stops the writer thread without committing what is still queued and waits for it to exit. Used
     * when the producers failed; does nothing once {@link #finish()} has returned.
     */
    public void abort() {
        if (!thread.isAlive()) {
            return;
        }
        thread.interrupt();
        boolean interrupted = Thread.interrupted();
        try {
            thread.join(ABORT_WAIT.toMillis());
        } catch (InterruptedException e) {
            interrupted = true;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
        int dropped = queue.size();
        queue.clear();
        if (thread.isAlive()) {
            log.warn("{} writer still running {} ms after abort", name, ABORT_WAIT.toMillis());
        } else {
            log.warn("{} writer aborted, {} queued items dropped", name, dropped);
        }
    }

    @SuppressWarnings("unchecked")
    private void drain() {
        List<T> batch = new ArrayList<>(batchSize);
        try {
            while (true) {
                Object next = queue.poll(idleFlush.toMillis(), TimeUnit.MILLISECONDS);
                if (next == null) {
                    commit(batch);
                    continue;
                }
                if (next == END) {
                    commit(batch);
                    return;
                }
                batch.add((T) next);
                if (batch.size() >= batchSize) {
                    commit(batch);
                }
            }
        } catch (InterruptedException e) {
            log.warn("{} writer interrupted with {} uncommitted items", name, batch.size());
            Thread.currentThread().interrupt();
        }
    }

    private void commit(List<T> batch) {
        if (batch.isEmpty()) {
            return;
        }
        try {
            int added = sink.commit(List.copyOf(batch));
            written.addAndGet(batch.size());
            inserted.addAndGet(added);
            log.debug("{} committed batch of {} ({} new)", name, batch.size(), added);
        } catch (RuntimeException e) {
            long first = Long.MAX_VALUE;
            long last = Long.MIN_VALUE;
            for (T item : batch) {
                long key = keyOf.applyAsLong(item);
                first = Math.min(first, key);
                last = Math.max(last, key);
            }
            FailedBatch failed = new FailedBatch(batch.size(), first, last, e.getMessage());
            failedBatches.add(failed);
            log.error("{} failed to commit batch of {} (keys {}..{})", name, batch.size(), first, last, e);
        } finally {
            batch.clear();
        }
    }
}
