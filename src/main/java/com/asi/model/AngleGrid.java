package com.asi.model;

/** Azimut o elevación por píxel, en grados. Puede contener NaN. */
public final class AngleGrid implements CoordinateGrid {

    public final double[][] values;

    public AngleGrid(double[][] values) {
        this.values = values;
    }

    @Override
    public int height() { return values.length; }

    @Override
    public int width() { return values.length == 0 ? 0 : values[0].length; }
}
