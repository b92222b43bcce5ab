package org.planet.core.generation;

import org.planet.core.climate.HadleyCache;
import org.planet.core.climate.PrecipitationModel;
import org.planet.core.climate.TemperatureModel;
import org.planet.core.terrain.ElevationModel;

/**
 * Empirical constants that can be overridden with JVM system properties
 * ({@code -Dplanet.elevation.multiplier=5.5} etc.).
 */
public class PlanetTuning {

    public record ClimateTuning(
            double elevationMultiplier,
            long hadleyCacheSize,
            double itczMaxBoost,
            double polarCosLatitude,
            double insolationCosine
    ) {}

    public static ClimateTuning climateTuning() {
        return new ClimateTuning(
                dprop("planet.elevation.multiplier", ElevationModel.DEFAULT_MULTIPLIER),
                lprop("planet.hadley.cacheSize", HadleyCache.DEFAULT_MAX_SIZE),
                dprop("planet.precip.itczMaxBoost", PrecipitationModel.DEFAULT_ITCZ_MAX_BOOST),
                dprop("planet.insolation.polarCosLatitude", TemperatureModel.DEFAULT_COS_POLAR_LATITUDE),
                dprop("planet.insolation.cosine", TemperatureModel.DEFAULT_INSOLATION_COSINE)
        );
    }

    public static double dprop(String key, double fallback) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            System.out.println("[WARN] Ignoring non-numeric " + key + "=" + raw);
            return fallback;
        }
    }

    public static long lprop(String key, long fallback) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            System.out.println("[WARN] Ignoring non-integer " + key + "=" + raw);
            return fallback;
        }
    }

    public static boolean bprop(String key, boolean fallback) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        return Boolean.parseBoolean(raw.trim());
    }
}
