package com.asi.model;

import com.asi.error.UnrecognizedShapeException;
import java.util.Arrays;

/**
 * Stack de imágenes tal como lo entrega el llamador: array N-D en orden row-major
 * (último eje el más rápido). Las cámaras de 8 a 16 bits y los datos float se guardan
 * como float sin pérdida; enteros de 32 bits y double se guardan como double.
 */
public final class ImageStack {

    private final int[] shape;
    private final float[] data;
    private final double[] wide;

    private ImageStack(float[] data, double[] wide, int[] shape) {
        int length = data != null ? data.length : wide.length;
        if (shape.length == 0) throw new UnrecognizedShapeException("Image stack needs at least one dimension");
        long expected = 1;
        for (int d : shape) {
            if (d <= 0) throw new UnrecognizedShapeException("Invalid dimension in shape " + Arrays.toString(shape));
            expected *= d;
        }
        if (expected != length) {
            throw new UnrecognizedShapeException("Shape " + Arrays.toString(shape) + " needs " + expected
                    + " pixels but buffer holds " + length);
        }
        this.shape = shape.clone();
        this.data = data;
        this.wide = wide;
    }

    /** Envuelve el buffer sin copiarlo. */
    public static ImageStack ofFloat(float[] data, int... shape) {
        return new ImageStack(data, null, shape);
    }

    /** Envuelve el buffer sin copiarlo; no hay redondeo a float. */
    public static ImageStack ofDouble(double[] data, int... shape) {
        return new ImageStack(null, data, shape);
    }

    // 32 bits no caben en la mantisa de un float
    public static ImageStack ofInt(int[] data, int... shape) {
        double[] d = new double[data.length];
        for (int i = 0; i < data.length; i++) d[i] = data[i];
        return new ImageStack(null, d, shape);
    }

    public static ImageStack ofUnsigned16(short[] data, int... shape) {
        float[] f = new float[data.length];
        for (int i = 0; i < data.length; i++) f[i] = data[i] & 0xFFFF;
        return new ImageStack(f, null, shape);
    }

    public static ImageStack ofUnsigned8(byte[] data, int... shape) {
        float[] f = new float[data.length];
        for (int i = 0; i < data.length; i++) f[i] = data[i] & 0xFF;
        return new ImageStack(f, null, shape);
    }

    public int rank() {
        return shape.length;
    }

    public int dim(int axis) {
        return shape[axis];
    }

    public int[] shape() {
        return shape.clone();
    }

    public int size() {
        return data != null ? data.length : wide.length;
    }

    /** null cuando el stack se guarda en double. */
    float[] buffer() {
        return data;
    }

    /** null cuando el stack se guarda en float. */
    double[] wideBuffer() {
        return wide;
    }

    @Override
    public String toString() {
        return "ImageStack" + Arrays.toString(shape);
    }
}
