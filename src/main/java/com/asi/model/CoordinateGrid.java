package com.asi.model;

/** Coordenadas por píxel resueltas para evaluar la pertenencia a una región. */
public interface CoordinateGrid {

    int height();

    int width();
}
