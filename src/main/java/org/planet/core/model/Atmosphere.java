package org.planet.core.model;

/**
 * Atmosphere parameters consumed by the climate models.
 *
 * @param mass                 total mass, kg
 * @param scaleHeight          m
 * @param greenhouseFactor     dimensionless multiplier (1 = none)
 * @param averagePrecipitation mm per year
 * @param maxPrecipitation     mm per year, used for normalization in summaries
 * @param snowToRainRatio      snow depth per unit of liquid precipitation
 * @param waterVaporRatio      mass fraction of water vapor (0 = dry lapse rate)
 * @param atmosphericHeight    m; above this the surface sees bare blackbody temperature
 */
public record Atmosphere(
        double mass,
        double scaleHeight,
        double greenhouseFactor,
        double averagePrecipitation,
        double maxPrecipitation,
        double snowToRainRatio,
        double waterVaporRatio,
        double atmosphericHeight
) {

    public static final double DEFAULT_SNOW_TO_RAIN_RATIO = 13.0;

    public Atmosphere {
        if (!(mass >= 0) || Double.isInfinite(mass)) {
            throw new IllegalArgumentException("Atmosphere mass must be finite and >= 0: " + mass);
        }
        if (!(scaleHeight > 0)) {
            throw new IllegalArgumentException("Atmosphere scaleHeight must be > 0: " + scaleHeight);
        }
        if (greenhouseFactor < 0) {
            throw new IllegalArgumentException("greenhouseFactor must be >= 0: " + greenhouseFactor);
        }
        if (averagePrecipitation < 0 || maxPrecipitation < 0) {
            throw new IllegalArgumentException("Precipitation budget must be >= 0: avg=" + averagePrecipitation
                    + " max=" + maxPrecipitation);
        }
        if (snowToRainRatio < 0) {
            throw new IllegalArgumentException("snowToRainRatio must be >= 0: " + snowToRainRatio);
        }
        if (waterVaporRatio < 0 || waterVaporRatio > 1) {
            throw new IllegalArgumentException("waterVaporRatio must be in [0,1]: " + waterVaporRatio);
        }
        if (atmosphericHeight < 0) {
            throw new IllegalArgumentException("atmosphericHeight must be >= 0: " + atmosphericHeight);
        }
    }

    /** Roughly Earth's atmosphere. */
    public static Atmosphere earthLike() {
        return new Atmosphere(5.15e18, 8500, 1.22, 990, 2500, DEFAULT_SNOW_TO_RAIN_RATIO, 0.0025, 100_000);
    }

    public boolean hasWaterVapor() {
        return waterVaporRatio > 0;
    }
}
