package org.planet.core.climate;

/**
 * Liquid-equivalent precipitation and snowfall for one cell and season, mm.
 */
public record Precipitation(double precipitation, double snow) {

    public static final Precipitation NONE = new Precipitation(0, 0);
}
