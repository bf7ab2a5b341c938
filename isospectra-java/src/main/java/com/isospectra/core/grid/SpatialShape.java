package com.isospectra.core.grid;

/**
 * The three trailing (spatial) extents of a field, in x, y, z order.
 * Fixed once a field is given; both the Fourier transform and the radial grid are built from it.
 */
public record SpatialShape(int sx, int sy, int sz) {

    public SpatialShape {
        if (sx <= 0 || sy <= 0 || sz <= 0) {
            throw new IllegalArgumentException(
                String.format("all spatial sizes must be positive, got (%d, %d, %d)", sx, sy, sz));
        }
        if ((long) sx * sy * sz > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("spatial volume exceeds maximum supported size");
        }
    }

    /**
     * Takes the trailing three entries of a field shape.
     */
    public static SpatialShape trailing(int[] shape) {
        if (shape.length < 3) {
            throw new IllegalArgumentException(
                String.format("shape has %d dimensions, at least 3 required", shape.length));
        }
        int n = shape.length;
        return new SpatialShape(shape[n - 3], shape[n - 2], shape[n - 1]);
    }

    public int size(int axis) {
        return switch (axis) {
            case 0 -> sx;
            case 1 -> sy;
            case 2 -> sz;
            default -> throw new IndexOutOfBoundsException("spatial axis " + axis + " out of bounds [0, 3)");
        };
    }

    /**
     * Number of cells in the spatial block.
     */
    public int volume() {
        return sx * sy * sz;
    }

    public int minDimension() {
        return Math.min(sx, Math.min(sy, sz));
    }

    /**
     * Number of usable radial bins, the Nyquist limit of the smallest dimension.
     */
    public int numKModes() {
        return minDimension() / 2;
    }

    public int[] toArray() {
        return new int[]{sx, sy, sz};
    }

    /**
     * Linear offset of a cell inside the row-major spatial block.
     */
    public int cellIndex(int x, int y, int z) {
        return (x * sy + y) * sz + z;
    }

    @Override
    public String toString() {
        return String.format("(%d, %d, %d)", sx, sy, sz);
    }
}
