package com.asi.model;

import java.util.Arrays;

/**
 * Límites ya validados y ordenados (low <= high en cada par).
 * Azimut/elevación: [low, high]. CCD: [x0, x1, y0, y1]. Geodésico: [lon0, lon1, lat0, lat1].
 */
public final class BoundarySpec {

    public final RegionMode mode;
    private final double[] bounds;

    public BoundarySpec(RegionMode mode, double[] bounds) {
        this.mode = mode;
        this.bounds = bounds.clone();
    }

    public double low(int axis) {
        return bounds[2 * axis];
    }

    public double high(int axis) {
        return bounds[2 * axis + 1];
    }

    public int axes() {
        return bounds.length / 2;
    }

    public double[] toArray() {
        return bounds.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoundarySpec)) return false;
        BoundarySpec other = (BoundarySpec) o;
        return mode == other.mode && Arrays.equals(bounds, other.bounds);
    }

    @Override
    public int hashCode() {
        return 31 * mode.hashCode() + Arrays.hashCode(bounds);
    }

    @Override
    public String toString() {
        return mode.label() + Arrays.toString(bounds);
    }
}
