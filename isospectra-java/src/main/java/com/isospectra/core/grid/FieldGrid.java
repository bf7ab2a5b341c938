package com.isospectra.core.grid;

import java.util.Arrays;
import java.util.Objects;

/**
 * Dense N-dimensional grid of doubles stored in row-major order (last axis varies fastest).
 * <p>
 * For spectral work the trailing three axes are spatial and any leading axes are channels
 * (field components, time slices). Instances are immutable: the backing array is copied on the
 * way in and on the way out.
 */
public record FieldGrid(int[] shape, double[] data) {

    public FieldGrid {
        Objects.requireNonNull(shape, "shape cannot be null");
        Objects.requireNonNull(data, "data cannot be null");

        if (shape.length == 0) {
            throw new IllegalArgumentException("shape must have at least one dimension");
        }

        long totalCells = 1;
        for (int size : shape) {
            if (size <= 0) {
                throw new IllegalArgumentException("all dimension sizes must be positive");
            }
            totalCells *= size;
            if (totalCells > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("total cell count exceeds maximum supported size");
            }
        }

        if (data.length != (int) totalCells) {
            throw new IllegalArgumentException(
                String.format("data length (%d) must match total cell count (%d)",
                             data.length, totalCells));
        }

        shape = shape.clone();
        data = data.clone();
    }

    public static FieldGrid of(double[] data, int... shape) {
        return new FieldGrid(shape, data);
    }

    public static FieldGrid zeros(int... shape) {
        long total = 1;
        for (int size : shape) {
            total *= Math.max(size, 0);
        }
        return new FieldGrid(shape, new double[(int) Math.min(total, Integer.MAX_VALUE)]);
    }

    /**
     * Grid filled with a single value.
     */
    public static FieldGrid constant(double value, int... shape) {
        var grid = zeros(shape);
        var values = new double[grid.size()];
        Arrays.fill(values, value);
        return new FieldGrid(shape, values);
    }

    @Override
    public int[] shape() {
        return shape.clone();
    }

    @Override
    public double[] data() {
        return data.clone();
    }

    public int rank() {
        return shape.length;
    }

    public int dimension(int axis) {
        return shape[axis];
    }

    public int size() {
        return data.length;
    }

    public double valueAt(int linearIndex) {
        return data[linearIndex];
    }

    public double get(int... indices) {
        return data[cellIndex(indices)];
    }

    /**
     * Converts multi-dimensional indices to a linear index
     */
    public int cellIndex(int[] indices) {
        Objects.requireNonNull(indices, "indices cannot be null");

        if (indices.length != rank()) {
            throw new IllegalArgumentException(
                String.format("indices length (%d) must match rank (%d)",
                             indices.length, rank()));
        }

        int linearIndex = 0;
        int stride = 1;

        for (int i = rank() - 1; i >= 0; i--) {
            if (indices[i] < 0 || indices[i] >= shape[i]) {
                throw new IndexOutOfBoundsException(
                    String.format("index %d out of bounds [0, %d) in dimension %d",
                                 indices[i], shape[i], i));
            }
            linearIndex += indices[i] * stride;
            stride *= shape[i];
        }

        return linearIndex;
    }

    /**
     * Converts a linear index to multi-dimensional indices
     */
    public int[] cellIndices(int linearIndex) {
        if (linearIndex < 0 || linearIndex >= size()) {
            throw new IndexOutOfBoundsException(
                String.format("linear index %d out of bounds [0, %d)", linearIndex, size()));
        }

        var indices = new int[rank()];
        int remaining = linearIndex;

        for (int i = rank() - 1; i >= 0; i--) {
            indices[i] = remaining % shape[i];
            remaining /= shape[i];
        }

        return indices;
    }

    /**
     * The trailing three extents. Only defined for grids of rank 3 or more.
     */
    public SpatialShape spatialShape() {
        return SpatialShape.trailing(shape);
    }

    /**
     * Product of all leading (non-spatial) extents; 1 for a purely spatial grid.
     */
    public int channelCount() {
        int channels = 1;
        for (int i = 0; i < rank() - 3; i++) {
            channels *= shape[i];
        }
        return channels;
    }

    /**
     * Copies the spatial block of one channel, channels being numbered in row-major order
     * over the leading axes.
     */
    public double[] copyChannel(int channel) {
        int channels = channelCount();
        if (channel < 0 || channel >= channels) {
            throw new IndexOutOfBoundsException(
                String.format("channel %d out of bounds [0, %d)", channel, channels));
        }
        int volume = spatialShape().volume();
        return Arrays.copyOfRange(data, channel * volume, (channel + 1) * volume);
    }

    /**
     * Sum of all cells, accumulated in storage order.
     */
    public double sum() {
        double total = 0.0;
        for (double value : data) {
            total += value;
        }
        return total;
    }

    /**
     * Cell-wise sum with a grid of the same shape.
     */
    public FieldGrid add(FieldGrid other) {
        Objects.requireNonNull(other, "other cannot be null");
        if (!Arrays.equals(shape, other.shape)) {
            throw new IllegalArgumentException(
                String.format("shape %s does not match %s",
                             Arrays.toString(other.shape), Arrays.toString(shape)));
        }
        var result = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            result[i] = data[i] + other.data[i];
        }
        return new FieldGrid(shape, result);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FieldGrid other)) return false;
        return Arrays.equals(shape, other.shape) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(shape), Arrays.hashCode(data));
    }

    @Override
    public String toString() {
        return String.format("FieldGrid{shape=%s, cells=%d}", Arrays.toString(shape), size());
    }
}
