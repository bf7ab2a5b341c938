package com.isospectra.spectrum;

import java.util.Arrays;
import java.util.Objects;

/**
 * A 1D isotropic power spectrum: one accumulated power value per radial bin, paired with the bin centres
 * {@code k = 1, 2, ..., numKModes}. Both arrays have the same length, which may be zero.
 */
public record PowerSpectrum(double[] kBinCenters, double[] power) {

    public PowerSpectrum {
        Objects.requireNonNull(kBinCenters, "kBinCenters cannot be null");
        Objects.requireNonNull(power, "power cannot be null");
        if (kBinCenters.length != power.length) {
            throw new IllegalArgumentException(
                String.format("kBinCenters length (%d) must match power length (%d)",
                             kBinCenters.length, power.length));
        }
        kBinCenters = kBinCenters.clone();
        power = power.clone();
    }

    public static PowerSpectrum empty() {
        return new PowerSpectrum(new double[0], new double[0]);
    }

    @Override
    public double[] kBinCenters() {
        return kBinCenters.clone();
    }

    @Override
    public double[] power() {
        return power.clone();
    }

    public int numKModes() {
        return power.length;
    }

    public boolean isEmpty() {
        return power.length == 0;
    }

    public double k(int bin) {
        return kBinCenters[bin];
    }

    public double powerAt(int bin) {
        return power[bin];
    }

    /**
     * Sum over all bins.
     */
    public double totalPower() {
        double total = 0.0;
        for (double value : power) {
            total += value;
        }
        return total;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PowerSpectrum other)) return false;
        return Arrays.equals(kBinCenters, other.kBinCenters) && Arrays.equals(power, other.power);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(kBinCenters), Arrays.hashCode(power));
    }

    @Override
    public String toString() {
        return String.format("PowerSpectrum{k=%s, power=%s}",
                             Arrays.toString(kBinCenters), Arrays.toString(power));
    }
}
