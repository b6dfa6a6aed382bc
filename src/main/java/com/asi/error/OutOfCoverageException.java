package com.asi.error;

/** Valor fuera del rango que cubre realmente el skymap o la imagen. */
public class OutOfCoverageException extends RegionMetricException {

    public OutOfCoverageException(String message) {
        super(message);
    }
}
