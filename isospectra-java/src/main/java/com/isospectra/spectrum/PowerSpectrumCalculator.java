package com.isospectra.spectrum;

import com.isospectra.core.grid.FieldGrid;
import com.isospectra.exceptions.InvalidFieldException;
import com.isospectra.performance.ParallelSpectrumOperations;
import com.isospectra.performance.RadialGridCache;
import com.isospectra.radial.IntegrationResult;
import com.isospectra.radial.RadialIntegrator;
import com.isospectra.transform.SpectralTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Computes the isotropic power spectrum of a gridded field.
 * <p>
 * The field's trailing three axes are spatial; leading axes (components, time slices) are summed in power.
 * The result holds {@code floor(min(sx, sy, sz) / 2)} bins with centres {@code 1..numKModes}. Calls are
 * independent: the same field always yields a bit-identical spectrum, in sequential and parallel mode alike.
 * <p>
 * Usage:
 * <pre>
 * try (var calculator = new PowerSpectrumCalculator()) {
 *     PowerSpectrum spectrum = calculator.compute1dPowerSpectrum(FieldGrid.of(values, 3, 64, 64, 64));
 * }
 * </pre>
 */
public class PowerSpectrumCalculator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PowerSpectrumCalculator.class);

    private final SpectrumConfig             config;
    private final ParallelSpectrumOperations parallel;
    private final RadialGridCache            radialGrids;
    private final SpectralTransformer        transformer;
    private final RadialIntegrator           integrator;

    public PowerSpectrumCalculator() {
        this(SpectrumConfig.sequential());
    }

    public PowerSpectrumCalculator(SpectrumConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.parallel = config.isParallel()
                        ? new ParallelSpectrumOperations(config.getThreadCount(), config.getParallelThreshold())
                        : null;
        this.radialGrids = config.getRadialGridCacheSize() > 0
                           ? new RadialGridCache(config.getRadialGridCacheSize())
                           : null;
        this.transformer = new SpectralTransformer(parallel);
        this.integrator = new RadialIntegrator(radialGrids);
        log.debug("Created calculator with {}", config);
    }

    /**
     * Field to (k bin centres, power per bin).
     *
     * @throws InvalidFieldException if the field has fewer than three dimensions
     */
    public PowerSpectrum compute1dPowerSpectrum(FieldGrid field) throws InvalidFieldException {
        return computeWithAccounting(field).spectrum();
    }

    /**
     * Like {@link #compute1dPowerSpectrum} but also reports the power dropped beyond the last bin.
     *
     * @throws InvalidFieldException if the field has fewer than three dimensions
     */
    public IntegrationResult computeWithAccounting(FieldGrid field) throws InvalidFieldException {
        var powerGrid = compute3dPowerSpectrum(field);
        return integrator.integrateWithAccounting(powerGrid);
    }

    /**
     * The intermediate centred, channel-summed 3D power grid.
     *
     * @throws InvalidFieldException if the field has fewer than three dimensions
     */
    public FieldGrid compute3dPowerSpectrum(FieldGrid field) throws InvalidFieldException {
        return transformer.transform(field);
    }

    /**
     * Radial integration of an already computed 3D power grid.
     */
    public PowerSpectrum integrate(FieldGrid powerGrid) {
        return integrator.integrate(powerGrid);
    }

    public SpectrumConfig getConfig() {
        return config;
    }

    /**
     * Radial grid cache statistics, or null when caching is disabled.
     */
    public RadialGridCache.CacheStats getCacheStats() {
        return radialGrids == null ? null : radialGrids.getStats();
    }

    @Override
    public void close() {
        if (parallel != null) {
            parallel.close();
        }
        if (radialGrids != null && log.isDebugEnabled()) {
            log.debug(radialGrids.getStats().format());
        }
    }
}
