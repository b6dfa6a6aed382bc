package com.asi.error;

/** Modo reconocido pero no implementado. */
public class UnsupportedModeException extends RegionMetricException {

    public UnsupportedModeException(String message) {
        super(message);
    }
}
