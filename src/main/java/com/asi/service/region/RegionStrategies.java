package com.asi.service.region;

import com.asi.model.RegionMode;
import com.asi.service.SkymapCoordinateResolver;

public final class RegionStrategies {

    private RegionStrategies() {
    }

    public static RegionStrategy forMode(RegionMode mode, SkymapCoordinateResolver resolver) {
        switch (mode) {
            case AZIMUTH:
                return SkyAngleRegion.azimuth(resolver);
            case ELEVATION:
                return SkyAngleRegion.elevation(resolver);
            case CCD:
                return new CcdRegion();
            case GEODETIC:
                return new GeodeticRegion(resolver);
            case GEOMAGNETIC:
                return new GeomagneticRegion();
        }
        throw new IllegalStateException("No region strategy for " + mode);
    }
}
