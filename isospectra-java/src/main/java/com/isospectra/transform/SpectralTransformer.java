package com.isospectra.transform;

import com.isospectra.core.grid.FieldGrid;
import com.isospectra.core.grid.SpatialShape;
import com.isospectra.exceptions.InvalidFieldException;
import com.isospectra.performance.ParallelSpectrumOperations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Turns a field into its 3D power grid.
 * <p>
 * The trailing three axes of the field are transformed with an unscaled forward DFT, shifted so the
 * zero frequency sits at index {@code n / 2} of every axis, divided by {@code sqrt(sx * sy * sz)} and
 * squared. Leading channel axes, however many there are, are summed away in ascending channel order.
 * <p>
 * Non-finite input values are not filtered and propagate into the power grid.
 */
public final class SpectralTransformer {

    private static final Logger log = LoggerFactory.getLogger(SpectralTransformer.class);

    private final ParallelSpectrumOperations parallel;

    /**
     * Sequential transformer.
     */
    public SpectralTransformer() {
        this(null);
    }

    /**
     * @param parallel pool used for large grids, or null to always run on the calling thread
     */
    public SpectralTransformer(ParallelSpectrumOperations parallel) {
        this.parallel = parallel;
    }

    /**
     * Computes the channel-summed, centred, normalised power grid of a field.
     *
     * @param field grid with at least three dimensions, the last three being spatial
     * @return rank-3 power grid with the field's spatial shape
     * @throws InvalidFieldException if the field has fewer than three dimensions
     */
    public FieldGrid transform(FieldGrid field) throws InvalidFieldException {
        Objects.requireNonNull(field, "field cannot be null");
        if (field.rank() < 3) {
            throw InvalidFieldException.tooFewDimensions(field.rank());
        }

        var spatial = field.spatialShape();
        int channels = field.channelCount();
        log.debug("Transforming field {} as {} channel(s) of {}", field, channels, spatial);

        var power = new double[spatial.volume()];
        if (parallel != null && channels > 1 && parallel.shouldParallelize((long) channels * spatial.volume())) {
            var channelPowers = parallel.mapInOrder(channels, channel -> channelPower(field, channel, false));
            for (var channelPower : channelPowers) {
                addInto(power, channelPower);
            }
        } else {
            boolean splitLines = parallel != null && parallel.shouldParallelize(spatial.volume());
            for (int channel = 0; channel < channels; channel++) {
                addInto(power, channelPower(field, channel, splitLines));
            }
        }

        return new FieldGrid(spatial.toArray(), power);
    }

    /**
     * Sums partial power grids of identical shape, in list order.
     */
    public static FieldGrid accumulate(List<FieldGrid> partials) {
        Objects.requireNonNull(partials, "partials cannot be null");
        if (partials.isEmpty()) {
            throw new IllegalArgumentException("Cannot accumulate an empty list of power grids");
        }
        var total = partials.get(0);
        for (int i = 1; i < partials.size(); i++) {
            total = total.add(partials.get(i));
        }
        return total;
    }

    private static void addInto(double[] total, double[] channelPower) {
        for (int cell = 0; cell < total.length; cell++) {
            total[cell] += channelPower[cell];
        }
    }

    /**
     * Power of one channel, already shifted into centred order.
     */
    private double[] channelPower(FieldGrid field, int channel, boolean splitLines) {
        var spatial = field.spatialShape();
        var re = field.copyChannel(channel);
        var im = new double[re.length];

        for (int axis = 2; axis >= 0; axis--) {
            transformAxis(re, im, spatial, axis, splitLines);
        }

        double norm = Math.sqrt((double) spatial.volume());
        var power = new double[re.length];
        int sx = spatial.sx(), sy = spatial.sy(), sz = spatial.sz();
        for (int x = 0; x < sx; x++) {
            int shiftedX = FrequencyShift.shiftedIndex(x, sx);
            for (int y = 0; y < sy; y++) {
                int shiftedY = FrequencyShift.shiftedIndex(y, sy);
                for (int z = 0; z < sz; z++) {
                    int source = spatial.cellIndex(x, y, z);
                    double a = re[source] / norm;
                    double b = im[source] / norm;
                    power[spatial.cellIndex(shiftedX, shiftedY, FrequencyShift.shiftedIndex(z, sz))] = a * a + b * b;
                }
            }
        }
        return power;
    }

    /**
     * Applies the 1D transform to every line of the block running along {@code axis}.
     */
    private void transformAxis(double[] re, double[] im, SpatialShape spatial, int axis, boolean splitLines) {
        int n = spatial.size(axis);
        if (n == 1) {
            return;
        }
        int stride = 1;
        for (int a = axis + 1; a < 3; a++) {
            stride *= spatial.size(a);
        }
        int lines = spatial.volume() / n;
        var transform = FourierTransforms.forLength(n);
        int lineStride = stride;

        if (splitLines) {
            parallel.forEachIndex(lines, line -> transformLine(re, im, transform, line, lineStride));
        } else {
            for (int line = 0; line < lines; line++) {
                transformLine(re, im, transform, line, lineStride);
            }
        }
    }

    private static void transformLine(double[] re, double[] im, FourierTransform transform, int line, int stride) {
        int n = transform.length();
        int start = (line / stride) * n * stride + (line % stride);
        var lineRe = new double[n];
        var lineIm = new double[n];
        for (int i = 0; i < n; i++) {
            lineRe[i] = re[start + i * stride];
            lineIm[i] = im[start + i * stride];
        }
        transform.forward(lineRe, lineIm);
        for (int i = 0; i < n; i++) {
            re[start + i * stride] = lineRe[i];
            im[start + i * stride] = lineIm[i];
        }
    }
}
