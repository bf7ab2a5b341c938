package com.isospectra.transform;

import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;

/**
 * Power-of-two transform backed by Commons Math's radix-2 FFT.
 */
final class Radix2Transform implements FourierTransform {

    private final int length;

    Radix2Transform(int length) {
        if (length <= 0 || !ArithmeticUtils.isPowerOfTwo(length)) {
            throw new IllegalArgumentException("radix-2 transform requires a power of two length, got " + length);
        }
        this.length = length;
    }

    @Override
    public int length() {
        return length;
    }

    @Override
    public void forward(double[] re, double[] im) {
        FastFourierTransformer.transformInPlace(new double[][]{re, im}, DftNormalization.STANDARD,
                                                TransformType.FORWARD);
    }

    /**
     * Inverse transform including the 1/N factor, so that inverse(forward(x)) == x.
     */
    void inverse(double[] re, double[] im) {
        FastFourierTransformer.transformInPlace(new double[][]{re, im}, DftNormalization.STANDARD,
                                                TransformType.INVERSE);
    }

    @Override
    public String toString() {
        return "Radix2Transform{length=" + length + "}";
    }
}
