package com.isospectra.radial;

import java.util.Arrays;

/**
 * Radial bin edges and centres for a given number of k modes.
 * <p>
 * Edges are {@code numKModes + 1} values evenly spaced from 0.5 to {@code numKModes} (inclusive);
 * the centre of bin {@code i} is {@code ceil((edges[i] + edges[i + 1]) / 2)}, which evaluates to
 * {@code i + 1}. Bins are right-closed: bin {@code b} (1-based) covers {@code (edges[b-2], edges[b-1]]},
 * and bin 1 takes everything up to and including the first edge.
 */
public final class RadialBins {

    public static final double FIRST_EDGE = 0.5;

    private final int      numKModes;
    private final double[] edges;
    private final double[] centers;

    private RadialBins(int numKModes) {
        if (numKModes < 0) {
            throw new IllegalArgumentException("numKModes must be non-negative, got " + numKModes);
        }
        this.numKModes = numKModes;
        this.edges = evenlySpaced(FIRST_EDGE, numKModes, numKModes + 1);
        this.centers = new double[numKModes];
        for (int i = 0; i < numKModes; i++) {
            centers[i] = Math.ceil((edges[i] + edges[i + 1]) / 2.0);
        }
    }

    public static RadialBins forModes(int numKModes) {
        return new RadialBins(numKModes);
    }

    /**
     * {@code count} evenly spaced values from {@code start} to {@code stop}, with the last value pinned to
     * {@code stop}. A single value yields {@code [start]}.
     */
    static double[] evenlySpaced(double start, double stop, int count) {
        var values = new double[count];
        if (count == 1) {
            values[0] = start;
            return values;
        }
        double step = (stop - start) / (count - 1);
        for (int i = 0; i < count; i++) {
            values[i] = start + i * step;
        }
        values[count - 1] = stop;
        return values;
    }

    /**
     * Index of the first edge not less than {@code value}, or {@code edges.length} if every edge is smaller.
     */
    public static int lowerBound(double[] edges, double value) {
        int lo = 0;
        int hi = edges.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (edges[mid] < value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /**
     * 1-based bin position of a radial distance, from 1 to {@code numKModes + 2}. Positions
     * outside {@code [1, numKModes]} are not binned.
     */
    public int binFor(double radius) {
        return lowerBound(edges, radius) + 1;
    }

    public boolean isBinned(int bin) {
        return bin >= 1 && bin <= numKModes;
    }

    public int numKModes() {
        return numKModes;
    }

    public double[] edges() {
        return edges.clone();
    }

    public double[] centers() {
        return centers.clone();
    }

    /**
     * Largest radius that still lands in a bin.
     */
    public double maxBinnedRadius() {
        return numKModes == 0 ? Double.NEGATIVE_INFINITY : edges[numKModes - 1];
    }

    @Override
    public String toString() {
        return String.format("RadialBins{numKModes=%d, edges=%s}", numKModes, Arrays.toString(edges));
    }
}
