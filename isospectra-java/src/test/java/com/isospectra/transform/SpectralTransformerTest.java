package com.isospectra.transform;

import com.isospectra.TestBase;
import com.isospectra.core.grid.FieldGrid;
import com.isospectra.exceptions.InvalidFieldException;
import com.isospectra.performance.ParallelSpectrumOperations;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SpectralTransformer Tests")
class SpectralTransformerTest extends TestBase {

    private final SpectralTransformer transformer = new SpectralTransformer();

    @ParameterizedTest
    @ValueSource(ints = {1, 2})
    @DisplayName("Fields with fewer than three dimensions are rejected")
    void rejectsLowRankFields(int rank) {
        var shape = new int[rank];
        Arrays.fill(shape, 4);
        var field = FieldGrid.zeros(shape);

        var exception = assertThrows(InvalidFieldException.class, () -> transformer.transform(field));

        assertEquals(rank, exception.rank());
        assertTrue(exception.getMessage().contains("at least 3"), exception.getMessage());
    }

    @Test
    @DisplayName("Single cosine mode splits power between +k and -k")
    void singleCosineMode() throws InvalidFieldException {
        // cos(2 pi x / 4) along the first spatial axis
        var values = new double[64];
        for (int x = 0; x < 4; x++) {
            for (int i = 0; i < 16; i++) {
                values[x * 16 + i] = Math.cos(2.0 * Math.PI * x / 4.0);
            }
        }

        var power = transformer.transform(FieldGrid.of(values, 4, 4, 4));

        // |F| = 32 at kx = +-1, divided by sqrt(64) and squared; zero frequency sits at index 2
        assertEquals(16.0, power.get(3, 2, 2), 1e-12);
        assertEquals(16.0, power.get(1, 2, 2), 1e-12);
        assertEquals(32.0, power.sum(), 1e-12);
        assertEquals(0.0, power.get(2, 2, 2), 1e-12);
    }

    @Test
    @DisplayName("Constant field puts all power on the zero frequency")
    void constantFieldIsDcOnly() throws InvalidFieldException {
        var power = transformer.transform(FieldGrid.constant(2.0, 5, 5, 5));

        // (2 * 125)^2 / 125
        assertEquals(500.0, power.get(2, 2, 2), 1e-9);
        assertEquals(500.0, power.sum(), 1e-9);
    }

    @ParameterizedTest
    @ValueSource(strings = {"4,4,4", "3,5,6", "1,7,2", "2,4,3,5", "2,2,3,3,3"})
    @DisplayName("Total power equals the field's sum of squares")
    void parsevalHolds(String dims) throws InvalidFieldException {
        var shape = Arrays.stream(dims.split(",")).mapToInt(Integer::parseInt).toArray();
        var field = randomField(shape);

        var power = transformer.transform(field);

        assertEquals(sumOfSquares(field), power.sum(), 1e-10 * field.size());
    }

    @Test
    @DisplayName("Output keeps the spatial shape and drops channel axes")
    void outputShape() throws InvalidFieldException {
        var power = transformer.transform(randomField(2, 3, 4, 5, 6));

        assertArrayEquals(new int[]{4, 5, 6}, power.shape());
    }

    @Test
    @DisplayName("Channels are summed in order")
    void channelsAreSummed() throws InvalidFieldException {
        var field = randomField(2, 3, 4, 4, 4);

        var partials = new ArrayList<FieldGrid>();
        for (int channel = 0; channel < field.channelCount(); channel++) {
            partials.add(transformer.transform(FieldGrid.of(field.copyChannel(channel), 4, 4, 4)));
        }

        assertEquals(SpectralTransformer.accumulate(partials), transformer.transform(field));
    }

    @Test
    @DisplayName("Accumulating requires matching partial grids")
    void accumulateValidation() {
        assertThrows(IllegalArgumentException.class, () -> SpectralTransformer.accumulate(List.of()));
        assertThrows(IllegalArgumentException.class,
            () -> SpectralTransformer.accumulate(List.of(FieldGrid.zeros(2, 2, 2), FieldGrid.zeros(2, 2, 3))));
    }

    @Test
    @DisplayName("Power grid of a real field is point-symmetric about the centre")
    void realFieldIsPointSymmetric() throws InvalidFieldException {
        var power = transformer.transform(randomField(5, 5, 5));

        for (int x = 0; x < 5; x++) {
            for (int y = 0; y < 5; y++) {
                for (int z = 0; z < 5; z++) {
                    assertEquals(power.get(x, y, z), power.get(4 - x, 4 - y, 4 - z), 1e-12);
                }
            }
        }
    }

    @Test
    @DisplayName("Circularly translating the field leaves the power grid unchanged")
    void translationInvariant() throws InvalidFieldException {
        var field = randomField(4, 6, 5);
        var shifted = new double[field.size()];
        for (int x = 0; x < 4; x++) {
            for (int y = 0; y < 6; y++) {
                for (int z = 0; z < 5; z++) {
                    shifted[field.cellIndex(new int[]{(x + 1) % 4, (y + 2) % 6, (z + 3) % 5})] = field.get(x, y, z);
                }
            }
        }

        var expected = transformer.transform(field);
        var actual = transformer.transform(FieldGrid.of(shifted, 4, 6, 5));

        assertRelativelyEquals(expected.data(), actual.data(), 1e-12);
    }

    @Test
    @DisplayName("Scaling the field scales power quadratically")
    void quadraticScaling() throws InvalidFieldException {
        var field = randomField(4, 4, 4);
        var doubled = field.add(field);

        var expected = transformer.transform(field).data();
        for (int i = 0; i < expected.length; i++) {
            expected[i] *= 4.0;
        }

        assertRelativelyEquals(expected, transformer.transform(doubled).data(), 1e-12);
    }

    @Test
    @DisplayName("Non-finite input propagates")
    void nonFiniteInputPropagates() throws InvalidFieldException {
        var values = randomDoubleArray(27, -1.0, 1.0);
        values[13] = Double.NaN;

        var power = transformer.transform(FieldGrid.of(values, 3, 3, 3));

        for (int i = 0; i < power.size(); i++) {
            assertTrue(Double.isNaN(power.valueAt(i)));
        }
    }

    @Test
    @DisplayName("Parallel execution is bit-identical to sequential")
    void parallelMatchesSequential() throws InvalidFieldException {
        var multiChannel = randomField(3, 6, 5, 8);
        var singleChannel = randomField(9, 8, 7);

        try (var parallel = new ParallelSpectrumOperations(4, 0)) {
            var parallelTransformer = new SpectralTransformer(parallel);

            assertEquals(transformer.transform(multiChannel), parallelTransformer.transform(multiChannel));
            assertEquals(transformer.transform(singleChannel), parallelTransformer.transform(singleChannel));
        }
    }
}
