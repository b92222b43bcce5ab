package org.planet.core.climate;

/**
 * Temperature at one location at the winter and at the summer solstice, K.
 * "Winter" is the northern winter solstice, so south of the equator it is usually the warmer value.
 */
public record SolsticeTemperature(double winter, double summer) {

    public TemperatureRange range() {
        return TemperatureRange.of(winter, summer);
    }

    /** Linear from winter (t = 0) to summer (t = 1). */
    public double lerp(double t) {
        return winter + (summer - winter) * t;
    }
}
