package com.asi.service.region;

import com.asi.model.BoundarySpec;
import com.asi.model.CanonicalStack;
import com.asi.model.CoordinateGrid;
import com.asi.model.RegionMask;
import com.asi.model.RegionMode;
import com.asi.model.Skymap;

/**
 * Lo que cada modo aporta al cálculo: reglas de rango de los límites, resolución de
 * coordenadas y predicado de pertenencia. El resto del pipeline no conoce el modo.
 */
public interface RegionStrategy {

    RegionMode mode();

    /** Nombre del eje para los mensajes de error (0: primer par de límites, 1: segundo). */
    String axisLabel(int axis);

    /** Falla antes de cualquier otra validación si el modo no está implementado. */
    default void checkSupported() {
    }

    void checkBounds(BoundarySpec bounds, CanonicalStack stack);

    CoordinateGrid resolve(BoundarySpec bounds, Skymap skymap, Double altitudeKm, CanonicalStack stack);

    RegionMask select(BoundarySpec bounds, CoordinateGrid grid);
}
