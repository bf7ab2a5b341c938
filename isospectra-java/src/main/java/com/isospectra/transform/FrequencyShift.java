package com.isospectra.transform;

/**
 * Circular shift that moves the zero-frequency bin of an FFT output to index {@code n / 2}.
 * <p>
 * For odd {@code n} this is the geometric centre {@code (n - 1) / 2}; for even {@code n} the zero
 * frequency sits half a cell past it.
 */
public final class FrequencyShift {

    private FrequencyShift() {
    }

    /**
     * Position of transform bin {@code index} after shifting an axis of size {@code n}.
     */
    public static int shiftedIndex(int index, int n) {
        return (index + n / 2) % n;
    }

    /**
     * Position of the zero frequency after shifting.
     */
    public static int zeroFrequencyIndex(int n) {
        return n / 2;
    }

    /**
     * Shifts a one-dimensional array, returning a new array.
     */
    public static double[] shift(double[] values) {
        int n = values.length;
        var shifted = new double[n];
        for (int i = 0; i < n; i++) {
            shifted[shiftedIndex(i, n)] = values[i];
        }
        return shifted;
    }
}
