package com.asi.service;

import com.asi.error.UnrecognizedShapeException;
import com.asi.model.CanonicalStack;
import com.asi.model.ImageStack;
import java.util.Arrays;

public class ChannelNormalizer {

    public CanonicalStack normalize(ImageStack images) {
        int[] s = images.shape();
        switch (s.length) {
            case 2:
                // Un solo frame mono
                return CanonicalStack.view(images, 1, s[0], s[1], 1);
            case 3:
                // [3, H, W] es un frame en color; cualquier otro 3-D es [H, W, frames]
                if (s[0] == 3) return CanonicalStack.view(images, 3, s[1], s[2], 1);
                return CanonicalStack.view(images, 1, s[0], s[1], s[2]);
            case 4:
                if (s[0] != 1 && s[0] != 3) {
                    throw new UnrecognizedShapeException("4-D image stack must have 1 or 3 channels on the first axis, got shape "
                            + Arrays.toString(s));
                }
                return CanonicalStack.view(images, s[0], s[1], s[2], s[3]);
            default:
                throw new UnrecognizedShapeException("Unsupported image stack shape " + Arrays.toString(s)
                        + ", expected [H,W], [H,W,N], [3,H,W] or [C,H,W,N]");
        }
    }
}
