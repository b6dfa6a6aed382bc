package com.asi.error;

/** Modo, aridad, valor de límite, región de área cero o selector estadístico inválido. */
public class ValidationException extends RegionMetricException {

    public ValidationException(String message) {
        super(message);
    }
}
