package com.asi.model;

/** Rejilla del detector: las coordenadas son los propios índices de píxel. */
public final class PixelGrid implements CoordinateGrid {

    private final int height;
    private final int width;

    public PixelGrid(int height, int width) {
        this.height = height;
        this.width = width;
    }

    @Override
    public int height() { return height; }

    @Override
    public int width() { return width; }
}
