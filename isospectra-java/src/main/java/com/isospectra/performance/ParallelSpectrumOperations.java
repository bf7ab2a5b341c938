package com.isospectra.performance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.function.IntConsumer;
import java.util.function.IntFunction;
import java.util.stream.IntStream;

/**
 * Parallel processing utilities for spectrum computation.
 * Runs independent work items (transform lines, channels) on a dedicated work-stealing pool.
 * Results of {@link #mapInOrder} keep index order so callers can reduce them deterministically.
 */
public final class ParallelSpectrumOperations implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ParallelSpectrumOperations.class);

    private final ForkJoinPool pool;
    private final int          parallelThreshold;

    public ParallelSpectrumOperations(int threadCount, int parallelThreshold) {
        int parallelism = Math.max(1, threadCount);
        this.pool = new ForkJoinPool(
            parallelism,
            ForkJoinPool.defaultForkJoinWorkerThreadFactory,
            null,
            true // async mode, tasks are never joined from inside
        );
        this.parallelThreshold = Math.max(0, parallelThreshold);
        log.debug("Created spectrum pool with parallelism {} and threshold {}", parallelism, this.parallelThreshold);
    }

    /**
     * Whether a job touching {@code cells} grid cells is large enough to split.
     */
    public boolean shouldParallelize(long cells) {
        return cells >= parallelThreshold;
    }

    public int getParallelism() {
        return pool.getParallelism();
    }

    /**
     * Runs {@code action} for every index in {@code [0, count)}, in no particular order.
     * Actions must touch disjoint state.
     */
    public void forEachIndex(int count, IntConsumer action) {
        if (count <= 1) {
            IntStream.range(0, count).forEach(action);
            return;
        }
        pool.submit(() -> IntStream.range(0, count).parallel().forEach(action)).join();
    }

    /**
     * Maps every index in {@code [0, count)} concurrently and returns the results in index order.
     */
    public <T> List<T> mapInOrder(int count, IntFunction<T> mapper) {
        if (count <= 1) {
            return IntStream.range(0, count).mapToObj(mapper).toList();
        }
        return pool.submit(() -> IntStream.range(0, count).parallel().mapToObj(mapper).toList()).join();
    }

    @Override
    public void close() {
        pool.shutdown();
    }
}
