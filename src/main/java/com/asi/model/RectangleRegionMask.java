package com.asi.model;

/** Recorte rectangular inclusivo [x0..x1] x [y0..y1] directamente sobre el detector. */
public final class RectangleRegionMask extends RegionMask {

    public final int x0, x1, y0, y1;
    private final int cols;

    public RectangleRegionMask(int gridHeight, int gridWidth, int x0, int x1, int y0, int y1) {
        super(gridHeight, gridWidth);
        this.x0 = x0;
        this.x1 = x1;
        this.y0 = y0;
        this.y1 = y1;
        this.cols = Math.max(0, x1 - x0 + 1);
    }

    @Override
    public int size() {
        return cols * Math.max(0, y1 - y0 + 1);
    }

    @Override
    public int row(int k) { return y0 + k / cols; }

    @Override
    public int col(int k) { return x0 + k % cols; }
}
