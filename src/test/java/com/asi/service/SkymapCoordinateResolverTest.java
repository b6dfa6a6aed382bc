package com.asi.service;

import com.asi.Fixtures;
import com.asi.error.OutOfCoverageException;
import com.asi.model.BoundarySpec;
import com.asi.model.GeodeticGrid;
import com.asi.model.RegionMode;
import com.asi.model.Skymap;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SkymapCoordinateResolverTest {

    private final SkymapCoordinateResolver resolver = new SkymapCoordinateResolver();
    private final Skymap skymap = Fixtures.geodeticSkymap();

    @Test
    void exactAltitude_selectsLayerAndNormalizesLongitude() {
        GeodeticGrid g = resolver.atAltitude(skymap, 110);
        assertEquals(110.0, g.altitudeKm);
        assertEquals(50.5, g.latitude[0][0], 1e-12);
        assertEquals(53.5, g.latitude[3][2], 1e-12);
        // 250 + 2 + 1 = 253 -> -107
        assertEquals(-107.0, g.longitude[3][2], 1e-12);
    }

    @Test
    void exactAltitude_equalsDegenerateInterpolation() {
        for (int a = 0; a < Fixtures.GEO_ALTITUDES.length; a++) {
            double alt = Fixtures.GEO_ALTITUDES[a];
            GeodeticGrid exact = resolver.atAltitude(skymap, alt);
            GeodeticGrid degenerate = resolver.interpolate(skymap, a, a, alt);
            for (int r = 0; r < 6; r++) {
                assertArrayEquals(exact.latitude[r], degenerate.latitude[r]);
                assertArrayEquals(exact.longitude[r], degenerate.longitude[r]);
            }
        }
    }

    @Test
    void betweenLayers_interpolatesPerPixel() {
        GeodeticGrid g = resolver.atAltitude(skymap, 100);
        // a mitad de camino entre las capas 0 y 1
        assertEquals(50.25, g.latitude[0][0], 1e-12);
        assertEquals(54.25, g.latitude[4][1], 1e-12);
        assertEquals(-109.5, g.longitude[0][0], 1e-12);
        assertEquals(-105.5, g.longitude[2][4], 1e-12);

        GeodeticGrid upper = resolver.atAltitude(skymap, 140);
        // 3/4 entre 110 y 150
        assertEquals(50.5 + 0.75 * 0.5, upper.latitude[0][0], 1e-12);
        assertEquals(-109 + 0.75, upper.longitude[0][0], 1e-12);
    }

    @Test
    void altitudeOutsideRange() {
        assertThrows(OutOfCoverageException.class, () -> resolver.atAltitude(skymap, 80));
        assertThrows(OutOfCoverageException.class, () -> resolver.atAltitude(skymap, 150.5));
        assertThrows(OutOfCoverageException.class, () -> resolver.atAltitude(skymap, Double.NaN));
    }

    @Test
    void normalizeLongitude_onlyAbove180() {
        assertEquals(-110.0, SkymapCoordinateResolver.normalizeLongitude(250));
        assertEquals(180.0, SkymapCoordinateResolver.normalizeLongitude(180));
        assertEquals(-20.0, SkymapCoordinateResolver.normalizeLongitude(-20));
    }

    @Test
    void coverage_boundsTouchingOrOutsideExtentRejected() {
        GeodeticGrid g = resolver.atAltitude(skymap, 110); // lon -109..-104, lat 50.5..55.5
        assertDoesNotThrow(() -> resolver.checkCoverage(g, geo(-108, -105, 51, 55)));
        assertThrows(OutOfCoverageException.class, () -> resolver.checkCoverage(g, geo(-109, -105, 51, 55)));
        assertThrows(OutOfCoverageException.class, () -> resolver.checkCoverage(g, geo(-108, -104, 51, 55)));
        assertThrows(OutOfCoverageException.class, () -> resolver.checkCoverage(g, geo(-108, -105, 40, 52)));
        assertThrows(OutOfCoverageException.class, () -> resolver.checkCoverage(g, geo(-108, -105, 52, 56)));
    }

    @Test
    void coverage_ignoresNonFinitePixels() {
        GeodeticGrid g = resolver.atAltitude(skymap, 110);
        g.latitude[0][0] = Double.NaN;
        g.longitude[5][5] = Double.NaN;
        assertDoesNotThrow(() -> resolver.checkCoverage(g, geo(-108, -105, 51, 55)));
    }

    private static BoundarySpec geo(double lon0, double lon1, double lat0, double lat1) {
        return new BoundarySpec(RegionMode.GEODETIC, new double[]{lon0, lon1, lat0, lat1});
    }
}
