package com.isospectra.radial;

import com.isospectra.core.grid.FieldGrid;
import com.isospectra.performance.RadialGridCache;
import com.isospectra.spectrum.PowerSpectrum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Collapses a 3D power grid into a 1D spectrum over spherical shells of constant {@code |k|}.
 * <p>
 * Every cell is assigned the 1-based bin {@code 1 + lowerBound(edges, r)} where {@code r} is its radial
 * distance. Cells whose bin lies outside {@code [1, numKModes]} are dropped without being reported in the
 * spectrum. With the first edge at 0.5 nothing can fall below bin 1, but corner cells of the grid
 * (radii past the last accepted edge) are always dropped; {@link #integrateWithAccounting} exposes how much
 * power that was.
 */
public final class RadialIntegrator {

    private static final Logger log = LoggerFactory.getLogger(RadialIntegrator.class);

    private final RadialGridCache radialGrids;

    /**
     * Integrator that builds a fresh radial grid on every call.
     */
    public RadialIntegrator() {
        this(null);
    }

    /**
     * @param radialGrids cache of radial grids by shape, or null to build every time
     */
    public RadialIntegrator(RadialGridCache radialGrids) {
        this.radialGrids = radialGrids;
    }

    /**
     * Radially integrates a rank-3 power grid.
     */
    public PowerSpectrum integrate(FieldGrid powerGrid) {
        return integrateWithAccounting(powerGrid).spectrum();
    }

    /**
     * Radially integrates a rank-3 power grid and reports the dropped tail power.
     */
    public IntegrationResult integrateWithAccounting(FieldGrid powerGrid) {
        Objects.requireNonNull(powerGrid, "powerGrid cannot be null");
        requireRank3(powerGrid);
        var shape = powerGrid.spatialShape();
        var radialGrid = radialGrids == null
                         ? RadialGridBuilder.build(shape)
                         : radialGrids.get(shape, RadialGridBuilder::build);
        return integrateWithAccounting(powerGrid, radialGrid);
    }

    /**
     * Integrates against a caller-supplied radial grid. The two grids must have the same number of
     * cells; their shapes are not compared.
     */
    public IntegrationResult integrateWithAccounting(FieldGrid powerGrid, FieldGrid radialGrid) {
        Objects.requireNonNull(powerGrid, "powerGrid cannot be null");
        Objects.requireNonNull(radialGrid, "radialGrid cannot be null");
        requireRank3(powerGrid);

        var bins = RadialBins.forModes(powerGrid.spatialShape().numKModes());
        int numKModes = bins.numKModes();
        var spectrum = new double[numKModes];
        double total = 0.0;
        double dropped = 0.0;
        int droppedCells = 0;

        for (int cell = 0; cell < powerGrid.size(); cell++) {
            double power = powerGrid.valueAt(cell);
            total += power;
            int bin = bins.binFor(radialGrid.valueAt(cell));
            if (bins.isBinned(bin)) {
                spectrum[bin - 1] += power;
            } else {
                dropped += power;
                droppedCells++;
            }
        }

        double binned = 0.0;
        for (double value : spectrum) {
            binned += value;
        }

        if (log.isDebugEnabled()) {
            log.debug("Integrated {} into {} bins, {} cells beyond radius {} dropped carrying {} of {} total power",
                      powerGrid.spatialShape(), numKModes, droppedCells, bins.maxBinnedRadius(), dropped, total);
        }

        return new IntegrationResult(new PowerSpectrum(bins.centers(), spectrum), binned, dropped, total,
                                     droppedCells);
    }

    private static void requireRank3(FieldGrid powerGrid) {
        if (powerGrid.rank() != 3) {
            throw new IllegalArgumentException(
                String.format("power grid must have rank 3, got %d", powerGrid.rank()));
        }
    }
}
