package com.asi.model;

import com.asi.error.ValidationException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum RegionMode {
    AZIMUTH(2),
    ELEVATION(2),
    CCD(4),
    GEODETIC(4),
    GEOMAGNETIC(4);

    public final int boundsArity;

    RegionMode(int boundsArity) {
        this.boundsArity = boundsArity;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RegionMode parse(String name) {
        if (name != null) {
            String trimmed = name.trim();
            for (RegionMode m : values()) {
                if (m.name().equalsIgnoreCase(trimmed)) return m;
            }
        }
        throw new ValidationException("Unrecognized region mode '" + name + "', expected one of " + labels());
    }

    static String labels() {
        return Arrays.stream(values()).map(RegionMode::label).collect(Collectors.joining(", ", "[", "]"));
    }
}
