package com.asi.service;

import com.asi.error.UnrecognizedShapeException;
import com.asi.model.ImageStack;
import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.ImageHDU;
import nom.tam.util.ArrayFuncs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Carga frames FITS en un {@link ImageStack}. Convención FITS: el eje de frames es el más
 * lento ([N][H][W]); aquí se pasa al final ([H, W, N]). Un cubo con 3 planos es un frame en color.
 */
public class FitsStackService {

    private static final Logger log = LoggerFactory.getLogger(FitsStackService.class);

    public ImageStack read(File fitsFile) throws IOException, FitsException {
        Frame frame = readImage(fitsFile);
        int[] d = frame.dims;
        switch (d.length) {
            case 2:
            case 3:
                if (d.length == 2 || d[0] == 3) return frame.toStack(frame.pixels, d);
                // Cubo mono [N][H][W] -> [H, W, N]
                return frame.toStack(moveFramesLast(frame.pixels, d[0], d[1] * d[2]), d[1], d[2], d[0]);
            case 4:
                if (d[1] != 3) break;
                // Cubo color [N][3][H][W] -> [3, H, W, N]
                return frame.toStack(moveFramesLast(frame.pixels, d[0], 3 * d[2] * d[3]), 3, d[2], d[3], d[0]);
            default:
                break;
        }
        throw new UnrecognizedShapeException("Unsupported FITS image dimensions " + Arrays.toString(d) + " in " + fitsFile.getName());
    }

    /** Un fichero por frame, todos del mismo tamaño (2-D mono o [3][H][W] color). */
    public ImageStack readFrames(List<File> files) throws IOException, FitsException {
        if (files.isEmpty()) throw new IllegalArgumentException("No FITS files given");

        int[] dims = null;
        double[] stacked = null;
        boolean exactInFloat = true;
        int frameSize = 0;
        for (int f = 0; f < files.size(); f++) {
            Frame frame = readImage(files.get(f));
            boolean color = frame.dims.length == 3 && frame.dims[0] == 3;
            if (frame.dims.length != 2 && !color) {
                throw new UnrecognizedShapeException(files.get(f).getName() + " is not a single frame: "
                        + Arrays.toString(frame.dims));
            }
            if (dims == null) {
                dims = frame.dims;
                frameSize = frame.pixels.length;
                stacked = new double[frameSize * files.size()];
            } else if (!Arrays.equals(dims, frame.dims)) {
                throw new UnrecognizedShapeException(files.get(f).getName() + " has dimensions " + Arrays.toString(frame.dims)
                        + ", expected " + Arrays.toString(dims));
            }
            exactInFloat &= frame.exactInFloat;
            for (int i = 0; i < frameSize; i++) stacked[i * files.size() + f] = frame.pixels[i];
        }

        log.debug("Stacked {} FITS frames of {}", files.size(), Arrays.toString(dims));
        Frame all = new Frame();
        all.exactInFloat = exactInFloat;
        if (dims.length == 2) return all.toStack(stacked, dims[0], dims[1], files.size());
        return all.toStack(stacked, 3, dims[1], dims[2], files.size());
    }

    private static class Frame {
        int[] dims;
        double[] pixels;
        // BITPIX 8, 16 y -32 caben en float; 32 y -64 se quedan en double
        boolean exactInFloat;

        ImageStack toStack(double[] values, int... shape) {
            if (!exactInFloat) return ImageStack.ofDouble(values, shape);
            float[] f = new float[values.length];
            for (int i = 0; i < values.length; i++) f[i] = (float) values[i];
            return ImageStack.ofFloat(f, shape);
        }
    }

    private Frame readImage(File f) throws IOException, FitsException {
        try (Fits fits = new Fits(f)) {
            for (BasicHDU<?> hdu : fits.read()) {
                if (!(hdu instanceof ImageHDU)) continue;
                Object kernel = hdu.getKernel();
                if (kernel == null) continue;
                int[] dims = ArrayFuncs.getDimensions(kernel);
                if (dims.length < 2) continue;

                Header header = hdu.getHeader();
                double bzero = header.getDoubleValue("BZERO", 0.0);
                double bscale = header.getDoubleValue("BSCALE", 1.0);

                Frame frame = new Frame();
                frame.dims = dims;
                Object flat = ArrayFuncs.flatten(kernel);
                frame.pixels = toPhysical(flat, bzero, bscale);
                frame.exactInFloat = flat instanceof byte[] || flat instanceof short[] || flat instanceof float[];
                return frame;
            }
        }
        throw new UnrecognizedShapeException("No image data found in " + f.getName());
    }

    // BITPIX 8 es sin signo en FITS; el resto con signo + BZERO/BSCALE
    private double[] toPhysical(Object flat, double bzero, double bscale) {
        if (flat instanceof byte[]) {
            byte[] b = (byte[]) flat;
            double[] out = new double[b.length];
            for (int i = 0; i < b.length; i++) out[i] = bzero + bscale * (b[i] & 0xFF);
            return out;
        }
        if (flat instanceof short[]) {
            short[] s = (short[]) flat;
            double[] out = new double[s.length];
            for (int i = 0; i < s.length; i++) out[i] = bzero + bscale * s[i];
            return out;
        }
        if (flat instanceof int[]) {
            int[] v = (int[]) flat;
            double[] out = new double[v.length];
            for (int i = 0; i < v.length; i++) out[i] = bzero + bscale * v[i];
            return out;
        }
        if (flat instanceof float[]) {
            float[] v = (float[]) flat;
            double[] out = new double[v.length];
            for (int i = 0; i < v.length; i++) out[i] = bzero + bscale * v[i];
            return out;
        }
        if (flat instanceof double[]) {
            double[] v = (double[]) flat;
            double[] out = new double[v.length];
            for (int i = 0; i < v.length; i++) out[i] = bzero + bscale * v[i];
            return out;
        }
        throw new UnrecognizedShapeException("Unsupported FITS pixel type " + flat.getClass().getSimpleName());
    }

    private static double[] moveFramesLast(double[] pixels, int frames, int frameSize) {
        double[] out = new double[pixels.length];
        for (int f = 0; f < frames; f++) {
            for (int i = 0; i < frameSize; i++) out[i * frames + f] = pixels[f * frameSize + i];
        }
        return out;
    }
}
