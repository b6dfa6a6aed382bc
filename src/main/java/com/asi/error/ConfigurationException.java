package com.asi.error;

/** Falta una entrada obligatoria (skymap, altitud). */
public class ConfigurationException extends RegionMetricException {

    public ConfigurationException(String message) {
        super(message);
    }
}
