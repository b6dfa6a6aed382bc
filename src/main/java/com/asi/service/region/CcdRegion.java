package com.asi.service.region;

import com.asi.error.OutOfCoverageException;
import com.asi.error.ValidationException;
import com.asi.model.BoundarySpec;
import com.asi.model.CanonicalStack;
import com.asi.model.CoordinateGrid;
import com.asi.model.PixelGrid;
import com.asi.model.RectangleRegionMask;
import com.asi.model.RegionMask;
import com.asi.model.RegionMode;
import com.asi.model.Skymap;

/** Recorte [x0..x1] x [y0..y1] inclusivo en píxeles del detector. No necesita skymap. */
public final class CcdRegion implements RegionStrategy {

    @Override
    public RegionMode mode() {
        return RegionMode.CCD;
    }

    @Override
    public String axisLabel(int axis) {
        return axis == 0 ? "ccd x" : "ccd y";
    }

    @Override
    public void checkBounds(BoundarySpec bounds, CanonicalStack stack) {
        for (int axis = 0; axis < 2; axis++) {
            if (bounds.low(axis) != Math.rint(bounds.low(axis)) || bounds.high(axis) != Math.rint(bounds.high(axis))) {
                throw new ValidationException(axisLabel(axis) + " bounds must be whole pixel indices, got " + bounds);
            }
        }
        int maxX = stack.width - 1;
        int maxY = stack.height - 1;
        if (bounds.low(0) < 0 || bounds.high(0) > maxX) {
            throw new OutOfCoverageException("ccd x bounds must lie within [0, " + maxX + "], got " + bounds);
        }
        if (bounds.low(1) < 0 || bounds.high(1) > maxY) {
            throw new OutOfCoverageException("ccd y bounds must lie within [0, " + maxY + "], got " + bounds);
        }
    }

    @Override
    public CoordinateGrid resolve(BoundarySpec bounds, Skymap skymap, Double altitudeKm, CanonicalStack stack) {
        return new PixelGrid(stack.height, stack.width);
    }

    @Override
    public RegionMask select(BoundarySpec bounds, CoordinateGrid grid) {
        return new RectangleRegionMask(grid.height(), grid.width(),
                (int) bounds.low(0), (int) bounds.high(0), (int) bounds.low(1), (int) bounds.high(1));
    }
}
