package com.asi.service.region;

import com.asi.error.UnsupportedModeException;
import com.asi.model.BoundarySpec;
import com.asi.model.CanonicalStack;
import com.asi.model.CoordinateGrid;
import com.asi.model.RegionMask;
import com.asi.model.RegionMode;
import com.asi.model.Skymap;

/** Reservado: no hay transformación geomagnética disponible todavía. */
public final class GeomagneticRegion implements RegionStrategy {

    @Override
    public RegionMode mode() {
        return RegionMode.GEOMAGNETIC;
    }

    @Override
    public String axisLabel(int axis) {
        return axis == 0 ? "magnetic longitude" : "magnetic latitude";
    }

    @Override
    public void checkSupported() {
        throw unsupported();
    }

    @Override
    public void checkBounds(BoundarySpec bounds, CanonicalStack stack) {
        throw unsupported();
    }

    @Override
    public CoordinateGrid resolve(BoundarySpec bounds, Skymap skymap, Double altitudeKm, CanonicalStack stack) {
        throw unsupported();
    }

    @Override
    public RegionMask select(BoundarySpec bounds, CoordinateGrid grid) {
        throw unsupported();
    }

    private static UnsupportedModeException unsupported() {
        return new UnsupportedModeException("geomagnetic regions are not supported yet");
    }
}
