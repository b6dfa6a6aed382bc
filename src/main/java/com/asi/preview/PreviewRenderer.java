package com.asi.preview;

import com.asi.model.CanonicalStack;
import com.asi.model.RegionMask;
import com.asi.model.RegionMode;

/** Colaborador externo que recibe la máscara para dibujarla. No influye en el resultado. */
@FunctionalInterface
public interface PreviewRenderer {

    void render(CanonicalStack stack, RegionMask mask, RegionMode mode);
}
