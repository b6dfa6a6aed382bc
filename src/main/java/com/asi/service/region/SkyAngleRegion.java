package com.asi.service.region;

import com.asi.error.ConfigurationException;
import com.asi.error.ValidationException;
import com.asi.model.AngleGrid;
import com.asi.model.BoundarySpec;
import com.asi.model.CanonicalStack;
import com.asi.model.CoordinateGrid;
import com.asi.model.RegionMask;
import com.asi.model.RegionMode;
import com.asi.model.Skymap;
import com.asi.service.RegionMaskBuilder;
import com.asi.service.SkymapCoordinateResolver;
import java.util.function.Function;

/**
 * Azimut o elevación: intervalo abierto (low, high) sobre la rejilla completa.
 * Los píxeles sin calibración (NaN, cerca del horizonte) nunca entran.
 */
public final class SkyAngleRegion implements RegionStrategy {

    private final RegionMode mode;
    private final double maxDegrees;
    private final double maxUpper;
    private final Function<Skymap, AngleGrid> coordinates;

    private SkyAngleRegion(RegionMode mode, double maxDegrees, double maxUpper, Function<Skymap, AngleGrid> coordinates) {
        this.mode = mode;
        this.maxDegrees = maxDegrees;
        this.maxUpper = maxUpper;
        this.coordinates = coordinates;
    }

    public static SkyAngleRegion azimuth(SkymapCoordinateResolver resolver) {
        return new SkyAngleRegion(RegionMode.AZIMUTH, 360.0, 360.0, resolver::azimuth);
    }

    public static SkyAngleRegion elevation(SkymapCoordinateResolver resolver) {
        // El intervalo es abierto: para que entre el cenit (90) el límite superior puede pasar de 90
        return new SkyAngleRegion(RegionMode.ELEVATION, 90.0, 180.0, resolver::elevation);
    }

    @Override
    public RegionMode mode() {
        return mode;
    }

    @Override
    public String axisLabel(int axis) {
        return mode.label();
    }

    @Override
    public void checkBounds(BoundarySpec bounds, CanonicalStack stack) {
        if (bounds.low(0) < 0 || bounds.low(0) > maxDegrees) {
            throw new ValidationException(mode.label() + " lower bound must lie within [0, " + (int) maxDegrees
                    + "] degrees, got " + bounds);
        }
        if (bounds.high(0) > maxUpper) {
            throw new ValidationException(mode.label() + " upper bound must not exceed " + (int) maxUpper
                    + " degrees, got " + bounds);
        }
    }

    @Override
    public CoordinateGrid resolve(BoundarySpec bounds, Skymap skymap, Double altitudeKm, CanonicalStack stack) {
        if (skymap == null) throw new ConfigurationException("A skymap is required for " + mode.label() + " regions");
        return coordinates.apply(skymap);
    }

    @Override
    public RegionMask select(BoundarySpec bounds, CoordinateGrid grid) {
        double[][] v = ((AngleGrid) grid).values;
        double low = bounds.low(0), high = bounds.high(0);
        return RegionMaskBuilder.collect(grid.height(), grid.width(), (r, c) -> {
            double a = v[r][c];
            return Double.isFinite(a) && a > low && a < high;
        });
    }
}
