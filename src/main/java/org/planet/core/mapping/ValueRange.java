package org.planet.core.mapping;

/**
 * Min / mean / max of a grid.
 */
public record ValueRange(double min, double average, double max) {

    public static final ValueRange ZERO = new ValueRange(0, 0, 0);

    public static ValueRange of(FloatGrid grid) {
        return new ValueRange(grid.min(), grid.mean(), grid.max());
    }
}
