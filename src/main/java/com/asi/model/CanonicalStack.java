package com.asi.model;

import com.asi.error.UnrecognizedShapeException;

/**
 * Vista [canales, alto, ancho, frames] sobre el buffer de un {@link ImageStack}.
 * Solo se añaden ejes de tamaño 1, así que el orden row-major no cambia y no hay copia.
 * La vista es de solo lectura.
 */
public final class CanonicalStack {

    public final int channels;
    public final int height;
    public final int width;
    public final int frames;
    private final float[] data;
    private final double[] wide;

    private CanonicalStack(float[] data, double[] wide, int channels, int height, int width, int frames) {
        this.data = data;
        this.wide = wide;
        this.channels = channels;
        this.height = height;
        this.width = width;
        this.frames = frames;
    }

    public static CanonicalStack view(ImageStack source, int channels, int height, int width, int frames) {
        if ((long) channels * height * width * frames != source.size()) {
            throw new UnrecognizedShapeException("Cannot view " + source + " as [" + channels + ", " + height
                    + ", " + width + ", " + frames + "]");
        }
        return new CanonicalStack(source.buffer(), source.wideBuffer(), channels, height, width, frames);
    }

    public double value(int channel, int y, int x, int frame) {
        int i = ((channel * height + y) * width + x) * frames + frame;
        return data != null ? data[i] : wide[i];
    }

    public boolean isMono() {
        return channels == 1;
    }

    @Override
    public String toString() {
        return "CanonicalStack[" + channels + ", " + height + ", " + width + ", " + frames + "]";
    }
}
