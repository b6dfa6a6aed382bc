package com.asi.model;

/** Máscara como lista de índices planos (row * gridWidth + col) en orden row-major. */
public final class IndexRegionMask extends RegionMask {

    private final int[] indices;

    public IndexRegionMask(int gridHeight, int gridWidth, int[] indices) {
        super(gridHeight, gridWidth);
        this.indices = indices;
    }

    @Override
    public int size() { return indices.length; }

    @Override
    public int row(int k) { return indices[k] / gridWidth; }

    @Override
    public int col(int k) { return indices[k] % gridWidth; }

    public int[] indices() {
        return indices.clone();
    }
}
