package com.asi.service.region;

import com.asi.error.ConfigurationException;
import com.asi.error.ValidationException;
import com.asi.model.BoundarySpec;
import com.asi.model.CanonicalStack;
import com.asi.model.CoordinateGrid;
import com.asi.model.GeodeticGrid;
import com.asi.model.RegionMask;
import com.asi.model.RegionMode;
import com.asi.model.Skymap;
import com.asi.service.RegionMaskBuilder;
import com.asi.service.SkymapCoordinateResolver;

/**
 * Caja lon/lat a una altitud dada. Límites inclusivos, evaluados sobre la rejilla interior
 * (sin la primera fila ni la primera columna del skymap); el índice interior (r, c)
 * se aplica tal cual al píxel (r, c) de la imagen.
 */
public final class GeodeticRegion implements RegionStrategy {

    private final SkymapCoordinateResolver resolver;

    public GeodeticRegion(SkymapCoordinateResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public RegionMode mode() {
        return RegionMode.GEODETIC;
    }

    @Override
    public String axisLabel(int axis) {
        return axis == 0 ? "longitude" : "latitude";
    }

    @Override
    public void checkBounds(BoundarySpec bounds, CanonicalStack stack) {
        if (bounds.low(0) < -180 || bounds.high(0) > 180) {
            throw new ValidationException("geodetic longitude bounds must lie within [-180, 180], got " + bounds);
        }
        if (bounds.low(1) < -90 || bounds.high(1) > 90) {
            throw new ValidationException("geodetic latitude bounds must lie within [-90, 90], got " + bounds);
        }
    }

    @Override
    public CoordinateGrid resolve(BoundarySpec bounds, Skymap skymap, Double altitudeKm, CanonicalStack stack) {
        if (skymap == null) throw new ConfigurationException("A skymap is required for geodetic regions");
        if (altitudeKm == null) throw new ConfigurationException("altitude_km is required for geodetic regions");
        GeodeticGrid grid = resolver.atAltitude(skymap, altitudeKm);
        resolver.checkCoverage(grid, bounds);
        return grid;
    }

    @Override
    public RegionMask select(BoundarySpec bounds, CoordinateGrid grid) {
        GeodeticGrid g = (GeodeticGrid) grid;
        double lon0 = bounds.low(0), lon1 = bounds.high(0);
        double lat0 = bounds.low(1), lat1 = bounds.high(1);
        int h = Math.max(0, grid.height() - 1);
        int w = Math.max(0, grid.width() - 1);
        // Supone rejilla de esquinas (H+1)x(W+1): la celda interior (r, c) es el pixel (r, c)
        return RegionMaskBuilder.collect(h, w, (r, c) -> {
            double lat = g.latitude[r + 1][c + 1];
            double lon = g.longitude[r + 1][c + 1];
            return lon >= lon0 && lon <= lon1 && lat >= lat0 && lat <= lat1;
        });
    }
}
