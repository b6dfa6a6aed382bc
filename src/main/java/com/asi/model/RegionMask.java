package com.asi.model;

/**
 * Conjunto transitorio de píxeles miembros de una región, sobre una rejilla
 * gridHeight x gridWidth. El miembro k apunta al píxel (row(k), col(k)) de cada frame.
 */
public abstract class RegionMask {

    public final int gridHeight;
    public final int gridWidth;

    protected RegionMask(int gridHeight, int gridWidth) {
        this.gridHeight = gridHeight;
        this.gridWidth = gridWidth;
    }

    public abstract int size();

    public abstract int row(int k);

    public abstract int col(int k);

    public boolean isEmpty() {
        return size() == 0;
    }

    /** Máscara booleana del tamaño de un frame, para el renderizado de preview. */
    public boolean[][] toRaster(int height, int width) {
        boolean[][] raster = new boolean[height][width];
        for (int k = 0; k < size(); k++) {
            int r = row(k), c = col(k);
            if (r < height && c < width) raster[r][c] = true;
        }
        return raster;
    }
}
