package com.isospectra.radial;

import com.isospectra.spectrum.PowerSpectrum;

import java.util.Objects;

/**
 * A radially integrated spectrum together with the power that fell outside every bin.
 *
 * @param spectrum     bin centres and accumulated power
 * @param binnedPower  sum of the spectrum, accumulated bin by bin
 * @param droppedPower power of cells beyond the last accepted edge
 * @param totalPower   sum of the whole power grid in storage order
 * @param droppedCells number of cells not assigned to any bin
 */
public record IntegrationResult(PowerSpectrum spectrum, double binnedPower, double droppedPower,
                                double totalPower, int droppedCells) {

    public IntegrationResult {
        Objects.requireNonNull(spectrum, "spectrum cannot be null");
        if (droppedCells < 0) {
            throw new IllegalArgumentException("droppedCells must be non-negative");
        }
    }

    /**
     * Absolute difference between the grid total and binned plus dropped power.
     */
    public double conservationError() {
        return Math.abs(totalPower - (binnedPower + droppedPower));
    }
}
