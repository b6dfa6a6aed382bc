package com.asi.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RegionMaskTest {

    @Test
    void rectangle_isInclusive() {
        RectangleRegionMask mask = new RectangleRegionMask(10, 10, 2, 4, 5, 6);
        assertEquals(6, mask.size());
        assertEquals(5, mask.row(0));
        assertEquals(2, mask.col(0));
        assertEquals(6, mask.row(5));
        assertEquals(4, mask.col(5));
    }

    @Test
    void index_decodesRowMajor() {
        IndexRegionMask mask = new IndexRegionMask(4, 5, new int[]{0, 7, 19});
        assertEquals(1, mask.row(1));
        assertEquals(2, mask.col(1));
        assertEquals(3, mask.row(2));
        assertEquals(4, mask.col(2));
    }

    @Test
    void toRaster_clipsToFrame() {
        IndexRegionMask mask = new IndexRegionMask(3, 3, new int[]{0, 8});
        boolean[][] raster = mask.toRaster(2, 2);
        assertTrue(raster[0][0]);
        assertFalse(raster[1][1]);
    }
}
