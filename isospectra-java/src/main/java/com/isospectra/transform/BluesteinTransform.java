package com.isospectra.transform;

import org.apache.commons.math3.util.FastMath;

/**
 * Arbitrary-length transform using Bluestein's chirp-z algorithm.
 * <p>
 * The length-N DFT is rewritten as a circular convolution with the chirp
 * {@code w[k] = exp(-i pi k^2 / N)}, evaluated with power-of-two FFTs of length
 * {@code M >= 2N - 1}. Chirp and its transformed conjugate are computed once per instance.
 */
final class BluesteinTransform implements FourierTransform {

    private final int             length;
    private final Radix2Transform convolution;
    private final double[]        chirpRe;
    private final double[]        chirpIm;
    // FFT of the conjugate chirp, wrapped for circular convolution
    private final double[]        kernelRe;
    private final double[]        kernelIm;

    BluesteinTransform(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("transform length must be positive, got " + length);
        }
        this.length = length;

        int m = Integer.highestOneBit(Math.max(1, 2 * length - 1));
        if (m < 2 * length - 1) {
            m <<= 1;
        }
        this.convolution = new Radix2Transform(m);

        chirpRe = new double[length];
        chirpIm = new double[length];
        long period = 2L * length;
        for (int k = 0; k < length; k++) {
            // k^2 mod 2N keeps the angle small and exact for large k
            long kk = ((long) k * k) % period;
            double angle = FastMath.PI * kk / length;
            chirpRe[k] = FastMath.cos(angle);
            chirpIm[k] = -FastMath.sin(angle);
        }

        kernelRe = new double[m];
        kernelIm = new double[m];
        kernelRe[0] = chirpRe[0];
        kernelIm[0] = -chirpIm[0];
        for (int k = 1; k < length; k++) {
            kernelRe[k] = chirpRe[k];
            kernelIm[k] = -chirpIm[k];
            kernelRe[m - k] = chirpRe[k];
            kernelIm[m - k] = -chirpIm[k];
        }
        convolution.forward(kernelRe, kernelIm);
    }

    @Override
    public int length() {
        return length;
    }

    @Override
    public void forward(double[] re, double[] im) {
        int m = convolution.length();
        var aRe = new double[m];
        var aIm = new double[m];
        for (int k = 0; k < length; k++) {
            aRe[k] = re[k] * chirpRe[k] - im[k] * chirpIm[k];
            aIm[k] = re[k] * chirpIm[k] + im[k] * chirpRe[k];
        }

        convolution.forward(aRe, aIm);
        for (int k = 0; k < m; k++) {
            double r = aRe[k] * kernelRe[k] - aIm[k] * kernelIm[k];
            double i = aRe[k] * kernelIm[k] + aIm[k] * kernelRe[k];
            aRe[k] = r;
            aIm[k] = i;
        }
        convolution.inverse(aRe, aIm);

        for (int k = 0; k < length; k++) {
            re[k] = aRe[k] * chirpRe[k] - aIm[k] * chirpIm[k];
            im[k] = aRe[k] * chirpIm[k] + aIm[k] * chirpRe[k];
        }
    }

    @Override
    public String toString() {
        return "BluesteinTransform{length=" + length + ", convolutionLength=" + convolution.length() + "}";
    }
}
