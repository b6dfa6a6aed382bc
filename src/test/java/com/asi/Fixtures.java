package com.asi;

import com.asi.model.ImageStack;
import com.asi.model.Skymap;

/** Stacks y skymaps sintéticos compartidos por los tests. */
public final class Fixtures {

    private Fixtures() {
    }

    @FunctionalInterface
    public interface MonoPixel {
        double value(int y, int x, int frame);
    }

    @FunctionalInterface
    public interface ColorPixel {
        double value(int channel, int y, int x, int frame);
    }

    /** Stack mono [h, w, n]. */
    public static ImageStack mono(int h, int w, int n, MonoPixel px) {
        double[] data = new double[h * w * n];
        for (int y = 0; y < h; y++)
            for (int x = 0; x < w; x++)
                for (int f = 0; f < n; f++)
                    data[(y * w + x) * n + f] = px.value(y, x, f);
        return ImageStack.ofDouble(data, h, w, n);
    }

    /** Stack color [3, h, w, n]. */
    public static ImageStack color(int h, int w, int n, ColorPixel px) {
        double[] data = new double[3 * h * w * n];
        for (int c = 0; c < 3; c++)
            for (int y = 0; y < h; y++)
                for (int x = 0; x < w; x++)
                    for (int f = 0; f < n; f++)
                        data[((c * h + y) * w + x) * n + f] = px.value(c, y, x, f);
        return ImageStack.ofDouble(data, 3, h, w, n);
    }

    /** 100x100x5 con valor 10 salvo un bloque 10x10 en la esquina (filas y columnas 0..9) a 100. */
    public static ImageStack scenarioStack() {
        return mono(100, 100, 5, (y, x, f) -> inBlock(y, x) ? 100 : 10);
    }

    /** Elevación 90 dentro del bloque, 0 fuera; azimut = columna * 3.6. */
    public static Skymap scenarioSkymap() {
        int n = 100;
        double[][] az = new double[n][n];
        double[][] el = new double[n][n];
        double[][][] lat = new double[n][n][1];
        double[][][] lon = new double[n][n][1];
        for (int y = 0; y < n; y++) {
            for (int x = 0; x < n; x++) {
                az[y][x] = x * 3.6;
                el[y][x] = inBlock(y, x) ? 90 : 0;
                lat[y][x][0] = 50 + y * 0.1;
                lon[y][x][0] = -110 + x * 0.1;
            }
        }
        return new Skymap(az, el, new double[]{110}, lat, lon);
    }

    public static final double[] GEO_ALTITUDES = {90, 110, 150};

    /**
     * Skymap 6x6 con tres altitudes. lat = 50 + fila + 0.5 * capa,
     * lon cruda = 250 + columna + capa (normalizada: -110 + columna + capa).
     */
    public static Skymap geodeticSkymap() {
        int n = 6;
        double[][] az = new double[n][n];
        double[][] el = new double[n][n];
        double[][][] lat = new double[n][n][GEO_ALTITUDES.length];
        double[][][] lon = new double[n][n][GEO_ALTITUDES.length];
        for (int y = 0; y < n; y++) {
            for (int x = 0; x < n; x++) {
                az[y][x] = x * 60;
                el[y][x] = y * 15;
                for (int a = 0; a < GEO_ALTITUDES.length; a++) {
                    lat[y][x][a] = 50 + y + 0.5 * a;
                    lon[y][x][a] = 250 + x + a;
                }
            }
        }
        return new Skymap(az, el, GEO_ALTITUDES, lat, lon);
    }

    /** 6x6x1 con valor 10 * fila + columna: cada píxel es identificable. */
    public static ImageStack indexedStack() {
        return mono(6, 6, 1, (y, x, f) -> 10 * y + x);
    }

    private static boolean inBlock(int y, int x) {
        return y < 10 && x < 10;
    }
}
