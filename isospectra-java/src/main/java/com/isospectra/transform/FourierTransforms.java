package com.isospectra.transform;

import org.apache.commons.math3.util.ArithmeticUtils;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Factory for one-dimensional transforms. Instances are immutable and shared per length.
 */
public final class FourierTransforms {

    private static final ConcurrentHashMap<Integer, FourierTransform> TRANSFORMS = new ConcurrentHashMap<>();

    private FourierTransforms() {
    }

    /**
     * Returns a forward transform for the given length: radix-2 for powers of two,
     * Bluestein otherwise.
     */
    public static FourierTransform forLength(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("transform length must be positive, got " + length);
        }
        return TRANSFORMS.computeIfAbsent(length, FourierTransforms::create);
    }

    private static FourierTransform create(int length) {
        if (ArithmeticUtils.isPowerOfTwo(length)) {
            return new Radix2Transform(length);
        }
        return new BluesteinTransform(length);
    }
}
