package com.isospectra.spectrum;

/**
 * Execution settings for {@link PowerSpectrumCalculator}. None of them changes the numbers produced:
 * bin count, edges and normalisation always derive from the field's shape alone.
 */
public class SpectrumConfig {
    private boolean parallel           = false;
    private int     threadCount        = Runtime.getRuntime().availableProcessors();
    private int     parallelThreshold  = 1 << 15; // cells
    private int     radialGridCacheSize = 10;

    public static SpectrumConfig sequential() {
        return new SpectrumConfig();
    }

    public static SpectrumConfig parallel() {
        return new SpectrumConfig().withParallel(true);
    }

    public boolean isParallel() {
        return parallel;
    }

    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public int getRadialGridCacheSize() {
        return radialGridCacheSize;
    }

    public int getThreadCount() {
        return threadCount;
    }

    public SpectrumConfig withParallel(boolean enable) {
        this.parallel = enable;
        return this;
    }

    public SpectrumConfig withParallelThreshold(int cells) {
        this.parallelThreshold = Math.max(0, cells);
        return this;
    }

    /**
     * Number of radial grids kept between calls; 0 disables caching.
     */
    public SpectrumConfig withRadialGridCacheSize(int size) {
        this.radialGridCacheSize = Math.max(0, size);
        return this;
    }

    public SpectrumConfig withThreadCount(int count) {
        this.threadCount = Math.max(1, count);
        return this;
    }

    @Override
    public String toString() {
        return String.format("SpectrumConfig{parallel=%s, threadCount=%d, parallelThreshold=%d, radialGridCacheSize=%d}",
                             parallel, threadCount, parallelThreshold, radialGridCacheSize);
    }
}
