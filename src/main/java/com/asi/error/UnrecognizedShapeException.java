package com.asi.error;

/** La dimensionalidad del stack no coincide con ningún formato soportado. */
public class UnrecognizedShapeException extends RegionMetricException {

    public UnrecognizedShapeException(String message) {
        super(message);
    }
}
