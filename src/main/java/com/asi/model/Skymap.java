package com.asi.model;

import java.util.Objects;

/**
 * Tabla de calibración geométrica de un imager. Los arrays no se copian y los getters
 * devuelven los mismos arrays (vista del llamador): el objeto se comparte entre hilos y
 * nadie debe modificarlos después de construirlo.
 */
public final class Skymap {

    private final double[][] azimuth;
    private final double[][] elevation;
    private final double[] altitudes;
    private final double[][][] latitude;
    private final double[][][] longitude;

    public Skymap(double[][] azimuth, double[][] elevation, double[] altitudes,
                  double[][][] latitude, double[][][] longitude) {
        this.azimuth = Objects.requireNonNull(azimuth, "azimuth");
        this.elevation = Objects.requireNonNull(elevation, "elevation");
        this.altitudes = Objects.requireNonNull(altitudes, "altitudes");
        this.latitude = Objects.requireNonNull(latitude, "latitude");
        this.longitude = Objects.requireNonNull(longitude, "longitude");

        if (altitudes.length == 0) throw new IllegalArgumentException("Skymap needs at least one reference altitude");
        for (int i = 1; i < altitudes.length; i++) {
            if (!(altitudes[i] > altitudes[i - 1])) {
                throw new IllegalArgumentException("Skymap altitudes must be strictly ascending");
            }
        }
        if (latitude.length != longitude.length || latitude.length == 0
                || latitude[0].length != longitude[0].length) {
            throw new IllegalArgumentException("Skymap latitude and longitude grids differ in size");
        }
        if (latitude[0][0].length != altitudes.length || longitude[0][0].length != altitudes.length) {
            throw new IllegalArgumentException("Skymap lat/lon layers do not match the " + altitudes.length + " altitudes");
        }
    }

    public double[][] azimuth() { return azimuth; }
    public double[][] elevation() { return elevation; }
    public double[] altitudes() { return altitudes; }
    public double[][][] latitude() { return latitude; }
    public double[][][] longitude() { return longitude; }

    public double minAltitude() { return altitudes[0]; }
    public double maxAltitude() { return altitudes[altitudes.length - 1]; }
}
