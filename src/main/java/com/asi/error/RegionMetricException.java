package com.asi.error;

/**
 * Base de todos los errores de extracción de métricas por región.
 * Son síncronos y no transitorios: nunca se reintentan.
 */
public class RegionMetricException extends RuntimeException {

    public RegionMetricException(String message) {
        super(message);
    }
}
