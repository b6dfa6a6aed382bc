package com.asi.error;

/** La región resuelta no contiene píxeles válidos. */
public class EmptyRegionException extends RegionMetricException {

    public EmptyRegionException(String message) {
        super(message);
    }
}
