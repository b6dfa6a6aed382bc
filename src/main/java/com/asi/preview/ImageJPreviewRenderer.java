package com.asi.preview;

import com.asi.model.AppConfig;
import com.asi.model.CanonicalStack;
import com.asi.model.RegionMask;
import com.asi.model.RegionMode;
import ij.ImagePlus;
import ij.gui.ImageRoi;
import ij.gui.Overlay;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import java.awt.GraphicsEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ImageJPreviewRenderer implements PreviewRenderer {

    private static final Logger log = LoggerFactory.getLogger(ImageJPreviewRenderer.class);

    @Override
    public void render(CanonicalStack stack, RegionMask mask, RegionMode mode) {
        ImagePlus imp = buildPreview(stack, mask, mode);
        if (GraphicsEnvironment.isHeadless()) {
            log.warn("Preview requested for {} region but no display is available", mode.label());
            return;
        }
        imp.show();
    }

    public ImagePlus buildPreview(CanonicalStack stack, RegionMask mask, RegionMode mode) {
        int frame = Math.min(Math.max(AppConfig.getPreviewFrame(), 0), stack.frames - 1);

        // Frame de fondo: en color se muestra la media de los canales
        FloatProcessor ip = new FloatProcessor(stack.width, stack.height);
        float[] px = (float[]) ip.getPixels();
        for (int y = 0; y < stack.height; y++) {
            for (int x = 0; x < stack.width; x++) {
                double v = 0;
                for (int c = 0; c < stack.channels; c++) v += stack.value(c, y, x, frame);
                px[y * stack.width + x] = (float) (v / stack.channels);
            }
        }
        ip.resetMinAndMax();

        ByteProcessor maskIp = new ByteProcessor(stack.width, stack.height);
        boolean[][] raster = mask.toRaster(stack.height, stack.width);
        for (int y = 0; y < stack.height; y++) {
            for (int x = 0; x < stack.width; x++) {
                if (raster[y][x]) maskIp.set(x, y, 255);
            }
        }

        ImageRoi roi = new ImageRoi(0, 0, maskIp);
        roi.setZeroTransparent(true);
        roi.setOpacity(AppConfig.getPreviewOpacity());

        ImagePlus imp = new ImagePlus(mode.label() + " region, frame " + frame + " (" + mask.size() + " px)", ip);
        imp.setOverlay(new Overlay(roi));
        return imp;
    }
}
