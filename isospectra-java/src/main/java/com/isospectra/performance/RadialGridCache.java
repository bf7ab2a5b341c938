package com.isospectra.performance;

import com.isospectra.core.grid.FieldGrid;
import com.isospectra.core.grid.SpatialShape;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * LRU cache of radial grids keyed by spatial shape.
 * Grids are immutable, so a cached grid may be shared by concurrent callers.
 * A cache with capacity 0 never stores anything.
 */
public final class RadialGridCache {

    private final ConcurrentHashMap<SpatialShape, FieldGrid> cache;
    private final ConcurrentHashMap<SpatialShape, Long>      accessTimes;
    private final int                                        maxSize;
    private final AtomicLong                                 currentTime = new AtomicLong(0);

    // Statistics
    private final AtomicLong hits      = new AtomicLong(0);
    private final AtomicLong misses    = new AtomicLong(0);
    private final AtomicLong evictions = new AtomicLong(0);

    public RadialGridCache(int maxSize) {
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must be non-negative, got " + maxSize);
        }
        this.maxSize = maxSize;
        this.cache = new ConcurrentHashMap<>(Math.max(1, maxSize));
        this.accessTimes = new ConcurrentHashMap<>(Math.max(1, maxSize));
    }

    public FieldGrid get(SpatialShape shape, Function<SpatialShape, FieldGrid> loader) {
        var grid = cache.get(shape);
        if (grid != null) {
            hits.incrementAndGet();
            accessTimes.put(shape, currentTime.incrementAndGet());
            return grid;
        }

        misses.incrementAndGet();
        var loaded = loader.apply(shape);
        put(shape, loaded);
        return loaded;
    }

    public void put(SpatialShape shape, FieldGrid grid) {
        if (maxSize == 0) {
            return;
        }
        cache.put(shape, grid);
        accessTimes.put(shape, currentTime.incrementAndGet());

        synchronized (this) {
            while (cache.size() > maxSize && evictLRU()) {
                // keep evicting
            }
        }
    }

    public boolean containsKey(SpatialShape shape) {
        return cache.containsKey(shape);
    }

    public int size() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
        accessTimes.clear();
        hits.set(0);
        misses.set(0);
        evictions.set(0);
    }

    private boolean evictLRU() {
        SpatialShape lruKey = null;
        long oldestTime = Long.MAX_VALUE;

        for (var entry : accessTimes.entrySet()) {
            long accessTime = entry.getValue();
            if (accessTime < oldestTime) {
                oldestTime = accessTime;
                lruKey = entry.getKey();
            }
        }

        if (lruKey == null) {
            // access time not recorded yet by a concurrent put
            var keys = cache.keySet().iterator();
            if (!keys.hasNext()) {
                return false;
            }
            lruKey = keys.next();
        }
        if (cache.remove(lruKey) != null) {
            evictions.incrementAndGet();
        }
        accessTimes.remove(lruKey);
        return true;
    }

    public CacheStats getStats() {
        long totalRequests = hits.get() + misses.get();
        double hitRate = totalRequests > 0 ? (double) hits.get() / totalRequests : 0.0;

        return new CacheStats(hits.get(), misses.get(), evictions.get(), hitRate, cache.size(), maxSize);
    }

    public record CacheStats(
        long hits,
        long misses,
        long evictions,
        double hitRate,
        int currentSize,
        int maxSize
    ) {
        public String format() {
            return String.format(
                "Radial grid cache: %.2f%% hit rate, %d/%d entries, %d hits, %d misses, %d evictions",
                hitRate * 100, currentSize, maxSize, hits, misses, evictions
            );
        }
    }
}
