package org.planet.core.generation;

import org.planet.core.climate.BiomeType;
import org.planet.core.climate.ClimateConstants;
import org.planet.core.climate.CoverRange;
import org.planet.core.climate.TemperatureRange;
import org.planet.core.mapping.CoverGrid;
import org.planet.core.mapping.FloatGrid;

import java.util.Map;

public final class Validation {

    /** Overshoot allowed on normalized elevation. */
    static final double ELEVATION_TOLERANCE = 1e-6;

    private Validation() {}

    public static void afterElevation(WorldContext ctx) {
        requireFinite("elevation", ctx.elevation);
        double min = ctx.elevation.min();
        double max = ctx.elevation.max();
        if (min < -1 - ELEVATION_TOLERANCE || max > 1 + ELEVATION_TOLERANCE) {
            throw new IllegalStateException("Normalized elevation out of [-1,1]: min=" + min + " max=" + max);
        }
        if (min == max && ctx.planet.maxElevation() > 0) {
            System.out.println("[WARN] Elevation seems constant: " + min);
        }
    }

    public static void afterTemperature(WorldContext ctx) {
        requireFinite("temperature.min", ctx.temperature.min());
        requireFinite("temperature.average", ctx.temperature.average());
        requireFinite("temperature.max", ctx.temperature.max());
        requireFinite("temperature.winter", ctx.winterTemperature);
        requireFinite("temperature.summer", ctx.summerTemperature);
        for (int y = 0; y < ctx.height(); y++) {
            for (int x = 0; x < ctx.width(); x++) {
                // TemperatureRange rejects min > avg > max itself
                TemperatureRange r = ctx.temperature.get(x, y);
                if (r.min() < 0) {
                    throw new IllegalStateException("Negative temperature at (" + x + "," + y + "): " + r);
                }
            }
        }
    }

    public static void afterPrecipitation(WorldContext ctx) {
        for (int i = 0; i < ctx.seasonPrecipitation.length; i++) {
            FloatGrid g = ctx.seasonPrecipitation[i];
            requireFinite("precipitation[" + i + "]", g);
            if (g.min() < 0) {
                throw new IllegalStateException("Negative precipitation in season " + i + ": " + g.min());
            }
        }
        if (ctx.seasonPrecipitation.length > 0) {
            double max = 0;
            for (FloatGrid g : ctx.seasonPrecipitation) max = Math.max(max, g.max());
            if (max <= 0) {
                System.out.println("[WARN] No precipitation anywhere in " + ctx.seasonPrecipitation.length + " seasons");
            }
        }
    }

    public static void afterSnowfall(WorldContext ctx) {
        int seasons = ctx.seasonSnowfall.length;
        for (int i = 0; i < seasons; i++) {
            FloatGrid g = ctx.seasonSnowfall[i];
            requireFinite("snowfall[" + i + "]", g);
            for (int y = 0; y < ctx.height(); y++) {
                for (int x = 0; x < ctx.width(); x++) {
                    float s = g.get(x, y);
                    if (s < 0) {
                        throw new IllegalStateException("Negative snowfall at (" + x + "," + y + ") season " + i);
                    }
                    if (s > 0) {
                        double t = ctx.seasonTemperatureAt(x, y, i);
                        if (t > ClimateConstants.FREEZING_POINT) {
                            throw new IllegalStateException("Snowfall above freezing at (" + x + "," + y
                                    + ") season " + i + ": T=" + t);
                        }
                    }
                }
            }
        }
    }

    public static void afterAggregate(WorldContext ctx) {
        requireFinite("totalPrecipitation", ctx.totalPrecipitation);
        requireFinite("averagePrecipitation", ctx.averagePrecipitation);
        requireFinite("totalSnowfall", ctx.totalSnowfall);
        int n = ctx.seasonCount();
        if (n == 0) return;
        for (int y = 0; y < ctx.height(); y++) {
            for (int x = 0; x < ctx.width(); x++) {
                double total = ctx.totalPrecipitation.get(x, y);
                double avg = ctx.averagePrecipitation.get(x, y);
                if (Math.abs(avg * n - total) > 1e-3 * Math.max(1.0, total)) {
                    throw new IllegalStateException("Season average does not match total at (" + x + "," + y
                            + "): avg=" + avg + " seasons=" + n + " total=" + total);
                }
            }
        }
    }

    public static void afterHydrology(WorldContext ctx) {
        requireFinite("hydrology.depth", ctx.hydrology.depth());
        requireFinite("hydrology.flow", ctx.hydrology.flow());
        if (ctx.hydrology.depth().min() < 0 || ctx.hydrology.flow().min() < 0) {
            throw new IllegalStateException("Negative lake depth or flow: depth.min=" + ctx.hydrology.depth().min()
                    + " flow.min=" + ctx.hydrology.flow().min());
        }
        if (ctx.hydrology.maxFlow() <= 0 && ctx.maxPrecipitation > 0 && ctx.landCellCount > 0) {
            System.out.println("[WARN] Precipitation falls but nothing flows downhill");
        }
    }

    public static void afterClassification(WorldContext ctx) {
        Map<BiomeType, Integer> biomes = ctx.biome.histogram();
        if (biomes.size() == 1 && ctx.projection.cellCount() > 1) {
            System.out.println("[WARN] Every cell has the same biome: " + biomes.keySet().iterator().next());
        }
    }

    public static void afterCover(WorldContext ctx) {
        checkCover("seaIce", ctx.seaIce);
        checkCover("snowCover", ctx.snowCover);
    }

    public static void afterResources(WorldContext ctx) {
        for (Map.Entry<String, FloatGrid> e : ctx.resources.entrySet()) {
            requireFinite("resource " + e.getKey(), e.getValue());
            if (e.getValue().min() < 0) {
                throw new IllegalStateException("Negative richness for " + e.getKey());
            }
            if (e.getValue().max() > 1) {
                System.out.println("[WARN] Richness above 1 for " + e.getKey() + ": " + e.getValue().max());
            }
        }
    }

    private static void checkCover(String name, CoverGrid grid) {
        for (int y = 0; y < grid.height(); y++) {
            for (int x = 0; x < grid.width(); x++) {
                CoverRange r = grid.get(x, y);
                if (!(r.start() >= 0 && r.start() <= 1 && r.end() >= 0 && r.end() <= 1)) {
                    throw new IllegalStateException(name + " window out of [0,1] at (" + x + "," + y + "): " + r);
                }
            }
        }
    }

    private static void requireFinite(String name, FloatGrid grid) {
        int i = grid.firstNonFinite();
        if (i >= 0) {
            throw new IllegalStateException("Non-finite value in " + name + " at x=" + (i % grid.width())
                    + " y=" + (i / grid.width()));
        }
    }
}
