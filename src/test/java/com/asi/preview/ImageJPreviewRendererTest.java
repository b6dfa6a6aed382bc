package com.asi.preview;

import com.asi.Fixtures;
import com.asi.model.CanonicalStack;
import com.asi.model.RectangleRegionMask;
import com.asi.model.RegionMode;
import com.asi.service.ChannelNormalizer;
import ij.ImagePlus;
import ij.gui.ImageRoi;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ImageJPreviewRendererTest {

    private final ImageJPreviewRenderer renderer = new ImageJPreviewRenderer();

    @Test
    void buildPreview_overlaysMaskOnFrame() {
        CanonicalStack stack = new ChannelNormalizer().normalize(Fixtures.mono(8, 12, 2, (y, x, f) -> x + y));
        ImagePlus imp = renderer.buildPreview(stack, new RectangleRegionMask(8, 12, 2, 5, 1, 3), RegionMode.CCD);

        assertEquals(12, imp.getWidth());
        assertEquals(8, imp.getHeight());
        assertEquals(1, imp.getOverlay().size());
        assertTrue(imp.getOverlay().get(0) instanceof ImageRoi);
        assertEquals(7.0f, imp.getProcessor().getf(4, 3));
    }

    @Test
    void buildPreview_colorFrameUsesChannelMean() {
        CanonicalStack stack = new ChannelNormalizer().normalize(Fixtures.color(2, 2, 1, (c, y, x, f) -> c * 3));
        ImagePlus imp = renderer.buildPreview(stack, new RectangleRegionMask(2, 2, 0, 0, 0, 0), RegionMode.CCD);
        assertEquals(3.0f, imp.getProcessor().getf(1, 1));
    }

    @Test
    void render_headlessDoesNotFail() {
        CanonicalStack stack = new ChannelNormalizer().normalize(Fixtures.mono(4, 4, 1, (y, x, f) -> 1));
        assertDoesNotThrow(() -> renderer.render(stack, new RectangleRegionMask(4, 4, 0, 1, 0, 1), RegionMode.CCD));
    }
}
