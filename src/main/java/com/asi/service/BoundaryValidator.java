package com.asi.service;

import com.asi.error.ValidationException;
import com.asi.model.BoundarySpec;
import com.asi.model.CanonicalStack;
import com.asi.service.region.RegionStrategy;
import java.util.Arrays;

public class BoundaryValidator {

    /**
     * Valida aridad y rangos y ordena cada par (low, high). Trabaja sobre una copia:
     * el array del llamador no se toca.
     */
    public BoundarySpec validate(RegionStrategy strategy, double[] bounds, CanonicalStack stack) {
        strategy.checkSupported();
        String mode = strategy.mode().label();
        int arity = strategy.mode().boundsArity;

        if (bounds == null || bounds.length != arity) {
            throw new ValidationException(mode + " regions need " + arity + " bounds, got "
                    + (bounds == null ? "none" : Arrays.toString(bounds)));
        }

        double[] b = bounds.clone();
        for (double v : b) {
            if (!Double.isFinite(v)) throw new ValidationException(mode + " bounds must be finite, got " + Arrays.toString(bounds));
        }

        // --- ORDEN Y ÁREA ---
        for (int axis = 0; axis < arity / 2; axis++) {
            int lo = 2 * axis, hi = lo + 1;
            if (b[lo] > b[hi]) {
                double tmp = b[lo];
                b[lo] = b[hi];
                b[hi] = tmp;
            }
            if (b[lo] == b[hi]) {
                throw new ValidationException(strategy.axisLabel(axis) + " bounds describe a zero-area region: "
                        + Arrays.toString(bounds));
            }
        }

        BoundarySpec spec = new BoundarySpec(strategy.mode(), b);
        strategy.checkBounds(spec, stack);
        return spec;
    }
}
