package com.asi.service.region;

import com.asi.model.BoundarySpec;
import com.asi.model.GeodeticGrid;
import com.asi.model.RegionMask;
import com.asi.model.RegionMode;
import com.asi.service.SkymapCoordinateResolver;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GeodeticRegionTest {

    private final GeodeticRegion region = new GeodeticRegion(new SkymapCoordinateResolver());

    /** lat = fila, lon = columna, 4x4. */
    private static GeodeticGrid grid() {
        double[][] lat = new double[4][4];
        double[][] lon = new double[4][4];
        for (int r = 0; r < 4; r++) {
            for (int c = 0; c < 4; c++) {
                lat[r][c] = r;
                lon[r][c] = c;
            }
        }
        return new GeodeticGrid(lat, lon, 110);
    }

    @Test
    void select_usesInteriorGridWithInclusiveBounds() {
        RegionMask mask = region.select(new BoundarySpec(RegionMode.GEODETIC, new double[]{1, 2, 2, 2.5}), grid());
        assertEquals(3, mask.gridHeight);
        assertEquals(3, mask.gridWidth);
        // lat == 2 en la fila 2 del skymap, lon 1..2 en columnas 1..2 -> fila interior 1, columnas 0..1
        assertEquals(2, mask.size());
        assertEquals(1, mask.row(0));
        assertEquals(0, mask.col(0));
        assertEquals(1, mask.col(1));
    }

    @Test
    void select_firstRowAndColumnNeverMatch() {
        RegionMask mask = region.select(new BoundarySpec(RegionMode.GEODETIC, new double[]{0, 0.5, 0, 0.5}), grid());
        assertTrue(mask.isEmpty());
    }

    @Test
    void select_nanPixelsExcluded() {
        GeodeticGrid g = grid();
        g.latitude[2][2] = Double.NaN;
        RegionMask mask = region.select(new BoundarySpec(RegionMode.GEODETIC, new double[]{1, 2, 2, 2.5}), g);
        assertEquals(1, mask.size());
    }
}
