package com.isospectra.transform;

import com.isospectra.TestBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks both transform implementations against a direct DFT.
 */
@DisplayName("FourierTransforms Tests")
class FourierTransformsTest extends TestBase {

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 15, 16, 17, 31, 32, 100, 127})
    @DisplayName("Forward transform matches direct DFT")
    void forwardMatchesDirectDft(int n) {
        var re = randomDoubleArray(n, -1.0, 1.0);
        var im = randomDoubleArray(n, -1.0, 1.0);
        var expected = directDft(re, im);

        FourierTransforms.forLength(n).forward(re, im);

        assertRelativelyEquals(expected[0], re, 1e-12);
        assertRelativelyEquals(expected[1], im, 1e-12);
    }

    @Test
    @DisplayName("Powers of two use radix-2, other lengths Bluestein")
    void implementationSelection() {
        assertInstanceOf(Radix2Transform.class, FourierTransforms.forLength(1));
        assertInstanceOf(Radix2Transform.class, FourierTransforms.forLength(64));
        assertInstanceOf(BluesteinTransform.class, FourierTransforms.forLength(3));
        assertInstanceOf(BluesteinTransform.class, FourierTransforms.forLength(288));
        assertSame(FourierTransforms.forLength(12), FourierTransforms.forLength(12));
    }

    @Test
    @DisplayName("Invalid lengths throw exception")
    void invalidLengths() {
        assertThrows(IllegalArgumentException.class, () -> FourierTransforms.forLength(0));
        assertThrows(IllegalArgumentException.class, () -> new Radix2Transform(6));
        assertThrows(IllegalArgumentException.class, () -> new BluesteinTransform(-1));
    }

    @Test
    @DisplayName("Transform is unscaled: constant input gives N at zero frequency")
    void transformIsUnscaled() {
        for (int n : new int[]{4, 5}) {
            var re = new double[n];
            var im = new double[n];
            Arrays.fill(re, 1.0);

            FourierTransforms.forLength(n).forward(re, im);

            assertEquals(n, re[0], 1e-12);
            for (int k = 1; k < n; k++) {
                assertEquals(0.0, re[k], 1e-12);
                assertEquals(0.0, im[k], 1e-12);
            }
        }
    }

    @Test
    @DisplayName("Real input has Hermitian symmetric output")
    void realInputIsHermitian() {
        int n = 9;
        var re = randomDoubleArray(n, -1.0, 1.0);
        var im = new double[n];

        FourierTransforms.forLength(n).forward(re, im);

        for (int k = 1; k < n; k++) {
            assertEquals(re[k], re[n - k], 1e-12);
            assertEquals(im[k], -im[n - k], 1e-12);
        }
    }

    private static double[][] directDft(double[] re, double[] im) {
        int n = re.length;
        var outRe = new double[n];
        var outIm = new double[n];
        for (int k = 0; k < n; k++) {
            for (int j = 0; j < n; j++) {
                double angle = -2.0 * Math.PI * ((long) k * j % n) / n;
                double c = Math.cos(angle);
                double s = Math.sin(angle);
                outRe[k] += re[j] * c - im[j] * s;
                outIm[k] += re[j] * s + im[j] * c;
            }
        }
        return new double[][]{outRe, outIm};
    }
}
