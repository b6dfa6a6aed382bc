package com.asi.service;

import com.asi.error.EmptyRegionException;
import com.asi.model.BoundarySpec;
import com.asi.model.CoordinateGrid;
import com.asi.model.IndexRegionMask;
import com.asi.model.RegionMask;
import com.asi.service.region.RegionStrategy;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RegionMaskBuilder {

    private static final Logger log = LoggerFactory.getLogger(RegionMaskBuilder.class);

    @FunctionalInterface
    public interface PixelPredicate {
        boolean test(int row, int col);
    }

    public RegionMask build(RegionStrategy strategy, BoundarySpec bounds, CoordinateGrid grid) {
        RegionMask mask = strategy.select(bounds, grid);
        if (mask.isEmpty()) {
            throw new EmptyRegionException("No valid pixels inside " + bounds);
        }
        log.debug("{} selected {} of {}x{} pixels", bounds, mask.size(), mask.gridHeight, mask.gridWidth);
        return mask;
    }

    /** Recorre la rejilla en orden row-major y guarda los índices que cumplen el predicado. */
    public static IndexRegionMask collect(int height, int width, PixelPredicate member) {
        int[] hits = new int[Math.max(16, height * width / 8)];
        int n = 0;
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                if (!member.test(r, c)) continue;
                if (n == hits.length) hits = Arrays.copyOf(hits, hits.length * 2);
                hits[n++] = r * width + c;
            }
        }
        return new IndexRegionMask(height, width, Arrays.copyOf(hits, n));
    }
}
