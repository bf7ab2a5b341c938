package com.isospectra.radial;

import com.isospectra.core.grid.FieldGrid;
import com.isospectra.core.grid.SpatialShape;

import java.util.Objects;

/**
 * Builds the grid of Euclidean distances, in index units, from the Fourier-space centre.
 * <p>
 * The centre of an axis of size {@code n} is {@code (n - 1) / 2}, which is a half-integer for even sizes.
 */
public final class RadialGridBuilder {

    private RadialGridBuilder() {
    }

    /**
     * Distance of cell {@code (x, y, z)} from the centre of {@code shape}.
     * Returns exactly the value stored in {@link #build(SpatialShape)} for that cell.
     */
    public static double distance(SpatialShape shape, int x, int y, int z) {
        double dx = x - center(shape.sx());
        double dy = y - center(shape.sy());
        double dz = z - center(shape.sz());
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    public static double center(int n) {
        return (n - 1) / 2.0;
    }

    /**
     * Materialises the radial grid for a spatial shape.
     */
    public static FieldGrid build(SpatialShape shape) {
        Objects.requireNonNull(shape, "shape cannot be null");
        var radii = new double[shape.volume()];
        for (int x = 0; x < shape.sx(); x++) {
            for (int y = 0; y < shape.sy(); y++) {
                for (int z = 0; z < shape.sz(); z++) {
                    radii[shape.cellIndex(x, y, z)] = distance(shape, x, y, z);
                }
            }
        }
        return new FieldGrid(shape.toArray(), radii);
    }
}
