package com.asi.model;

/** Latitud/longitud por píxel a una altitud concreta. Longitudes en (-180, 180]. */
public final class GeodeticGrid implements CoordinateGrid {

    public final double[][] latitude;
    public final double[][] longitude;
    public final double altitudeKm;

    public GeodeticGrid(double[][] latitude, double[][] longitude, double altitudeKm) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.altitudeKm = altitudeKm;
    }

    @Override
    public int height() { return latitude.length; }

    @Override
    public int width() { return latitude.length == 0 ? 0 : latitude[0].length; }
}
