package org.planet.core.climate;

/**
 * Yearly temperature span at one location, K. Always min <= average <= max.
 */
public record TemperatureRange(double min, double average, double max) {

    public static final TemperatureRange ZERO = new TemperatureRange(0, 0, 0);

    public TemperatureRange {
        if (!(min <= average && average <= max)) {
            throw new IllegalArgumentException("Expected min <= average <= max, got "
                    + min + " / " + average + " / " + max);
        }
    }

    /** Range from two extremes in either order; average is the midpoint. */
    public static TemperatureRange of(double a, double b) {
        double lo = Math.min(a, b);
        double hi = Math.max(a, b);
        return new TemperatureRange(lo, lo + (hi - lo) / 2, hi);
    }

    /** Linear interpolation from min (t = 0) to max (t = 1). */
    public double lerp(double t) {
        return min + (max - min) * t;
    }
}
