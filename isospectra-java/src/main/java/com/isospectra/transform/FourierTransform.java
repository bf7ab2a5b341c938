package com.isospectra.transform;

/**
 * In-place one-dimensional discrete Fourier transform of fixed length.
 * <p>
 * Forward transforms compute {@code X[k] = sum_n x[n] exp(-2 pi i k n / N)} with no scaling;
 * any normalisation is applied by the caller.
 */
public interface FourierTransform {

    /**
     * The number of points this transform operates on.
     */
    int length();

    /**
     * Replaces {@code (re, im)} by its forward transform.
     *
     * @param re real parts, length {@link #length()}
     * @param im imaginary parts, length {@link #length()}
     */
    void forward(double[] re, double[] im);
}
