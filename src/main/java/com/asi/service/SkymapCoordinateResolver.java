package com.asi.service;

import com.asi.error.OutOfCoverageException;
import com.asi.model.AngleGrid;
import com.asi.model.BoundarySpec;
import com.asi.model.GeodeticGrid;
import com.asi.model.Skymap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SkymapCoordinateResolver {

    private static final Logger log = LoggerFactory.getLogger(SkymapCoordinateResolver.class);

    public AngleGrid azimuth(Skymap skymap) {
        return new AngleGrid(skymap.azimuth());
    }

    public AngleGrid elevation(Skymap skymap) {
        return new AngleGrid(skymap.elevation());
    }

    /**
     * Lat/lon por píxel a la altitud pedida. Si coincide con una altitud de referencia se
     * usa esa capa; si no, interpolación lineal por píxel entre las dos que la rodean.
     */
    public GeodeticGrid atAltitude(Skymap skymap, double altitudeKm) {
        double[] alts = skymap.altitudes();
        if (!(altitudeKm >= skymap.minAltitude() && altitudeKm <= skymap.maxAltitude())) {
            throw new OutOfCoverageException("Altitude " + altitudeKm + " km is outside the skymap range ["
                    + skymap.minAltitude() + ", " + skymap.maxAltitude() + "] km");
        }

        for (int i = 0; i < alts.length; i++) {
            if (alts[i] == altitudeKm) {
                log.debug("Altitude {} km matches skymap layer {}", altitudeKm, i);
                return layer(skymap, i);
            }
        }

        int upper = 1;
        while (alts[upper] < altitudeKm) upper++;
        log.debug("Interpolating altitude {} km between {} and {} km", altitudeKm, alts[upper - 1], alts[upper]);
        return interpolate(skymap, upper - 1, upper, altitudeKm);
    }

    GeodeticGrid layer(Skymap skymap, int index) {
        double[][][] lat = skymap.latitude();
        double[][][] lon = skymap.longitude();
        int h = lat.length, w = lat[0].length;
        double[][] outLat = new double[h][w];
        double[][] outLon = new double[h][w];
        for (int r = 0; r < h; r++) {
            for (int c = 0; c < w; c++) {
                outLat[r][c] = lat[r][c][index];
                outLon[r][c] = normalizeLongitude(lon[r][c][index]);
            }
        }
        return new GeodeticGrid(outLat, outLon, skymap.altitudes()[index]);
    }

    // Con lower == upper la interpolación degenera en la capa exacta
    GeodeticGrid interpolate(Skymap skymap, int lower, int upper, double altitudeKm) {
        double[] alts = skymap.altitudes();
        double t = (upper == lower) ? 0.0 : (altitudeKm - alts[lower]) / (alts[upper] - alts[lower]);
        double[][][] lat = skymap.latitude();
        double[][][] lon = skymap.longitude();
        int h = lat.length, w = lat[0].length;
        double[][] outLat = new double[h][w];
        double[][] outLon = new double[h][w];
        for (int r = 0; r < h; r++) {
            for (int c = 0; c < w; c++) {
                double la0 = lat[r][c][lower], la1 = lat[r][c][upper];
                double lo0 = normalizeLongitude(lon[r][c][lower]);
                double lo1 = normalizeLongitude(lon[r][c][upper]);
                outLat[r][c] = la0 + t * (la1 - la0);
                outLon[r][c] = lo0 + t * (lo1 - lo0);
            }
        }
        return new GeodeticGrid(outLat, outLon, altitudeKm);
    }

    /**
     * Los límites pedidos deben quedar estrictamente dentro del min/max de la cobertura
     * resuelta; tocar el borde ya cuenta como fuera.
     */
    public void checkCoverage(GeodeticGrid grid, BoundarySpec bounds) {
        double[] lat = finiteRange(grid.latitude);
        double[] lon = finiteRange(grid.longitude);
        if (lat == null || lon == null) {
            throw new OutOfCoverageException("Skymap has no valid geodetic coverage at " + grid.altitudeKm + " km");
        }
        if (bounds.low(0) <= lon[0] || bounds.high(0) >= lon[1]) {
            throw new OutOfCoverageException(String.format("No skymap coverage for longitude bounds [%s, %s], covered range is (%s, %s)",
                    bounds.low(0), bounds.high(0), lon[0], lon[1]));
        }
        if (bounds.low(1) <= lat[0] || bounds.high(1) >= lat[1]) {
            throw new OutOfCoverageException(String.format("No skymap coverage for latitude bounds [%s, %s], covered range is (%s, %s)",
                    bounds.low(1), bounds.high(1), lat[0], lat[1]));
        }
    }

    static double normalizeLongitude(double lon) {
        return lon > 180 ? lon - 360 : lon;
    }

    private static double[] finiteRange(double[][] values) {
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (double[] row : values) {
            for (double v : row) {
                if (!Double.isFinite(v)) continue;
                if (v < min) min = v;
                if (v > max) max = v;
            }
        }
        return min <= max ? new double[]{min, max} : null;
    }
}
