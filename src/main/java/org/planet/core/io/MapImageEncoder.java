package org.planet.core.io;

import org.planet.core.climate.BiomeType;
import org.planet.core.mapping.EnumGrid;
import org.planet.core.mapping.FloatGrid;
import org.planet.core.mapping.RangeGrid;
import org.planet.core.mapping.SurfaceMaps;

import java.io.IOException;
import java.util.function.DoubleToIntFunction;

/**
 * Перевод слоёв карты в ARGB-пиксели. Палитры те же, что в старом рендерере, только без JavaFX.
 */
public final class MapImageEncoder {

    public static final String ELEVATION = "elevation";
    public static final String TEMPERATURE = "temperature";
    public static final String PRECIPITATION = "precipitation";
    public static final String BIOME = "biome";

    // named colors, 0xRRGGBB
    private static final int DARKBLUE = 0x00008B;
    private static final int TURQUOISE = 0x40E0D0;
    private static final int GREEN = 0x008000;
    private static final int SADDLEBROWN = 0x8B4513;
    private static final int WHITE = 0xFFFFFF;
    private static final int LIGHTBLUE = 0xADD8E6;
    private static final int GOLD = 0xFFD700;
    private static final int RED = 0xFF0000;
    private static final int SANDYBROWN = 0xF4A460;
    private static final int YELLOWGREEN = 0x9ACD32;
    private static final int DARKGREEN = 0x006400;

    private static final double LIGHT_AZIMUTH = Math.toRadians(315);
    private static final double LIGHT_ALTITUDE = Math.toRadians(45);

    private final double shadeStrength;

    public MapImageEncoder() {
        this(0.35);
    }

    public MapImageEncoder(double shadeStrength) {
        if (shadeStrength < 0 || shadeStrength > 1) {
            throw new IllegalArgumentException("shadeStrength must be in [0,1]: " + shadeStrength);
        }
        this.shadeStrength = shadeStrength;
    }

    /** Пишет все присутствующие слои в sink. Отсутствующие слои пропускаются. */
    public void encodeAll(SurfaceMaps maps, RasterSink sink) throws IOException {
        int w = maps.width();
        int h = maps.height();
        sink.write(ELEVATION, w, h, elevation(maps));
        if (maps.temperature() != null) {
            sink.write(TEMPERATURE, w, h, temperature(maps.temperature()));
        }
        if (maps.averagePrecipitation() != null) {
            sink.write(PRECIPITATION, w, h, precipitation(maps.averagePrecipitation()));
        }
        if (maps.biome() != null) {
            sink.write(BIOME, w, h, biome(maps.biome()));
        }
    }

    /** Рельеф с отмывкой. Вода по глубине, суша по высоте, без гидросферы всё считается сушей. */
    public int[] elevation(SurfaceMaps maps) {
        FloatGrid e = maps.elevation();
        int w = e.width();
        int h = e.height();
        int[] out = new int[w * h];
        double min = e.min();
        double max = e.max();
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double v = e.get(x, y);
                int rgb;
                if (maps.isLand(x, y)) {
                    double n = norm(v, maps.hasHydrosphere() ? 0 : min, max);
                    rgb = landColor(n);
                    rgb = shade(rgb, hillshade(e, x, y));
                } else {
                    double n = norm(v, min, 0);
                    rgb = lerp(DARKBLUE, TURQUOISE, n);
                }
                out[y * w + x] = opaque(rgb);
            }
        }
        return out;
    }

    public int[] temperature(RangeGrid temperature) {
        FloatGrid avg = temperature.average();
        double min = avg.min();
        double max = avg.max();
        return ramp(avg, v -> temperatureColor(norm(v, min, max)));
    }

    public int[] precipitation(FloatGrid precipitation) {
        double max = precipitation.max();
        return ramp(precipitation, v -> moistureColor(norm(v, 0, max)));
    }

    public int[] biome(EnumGrid<BiomeType> biome) {
        int w = biome.width();
        int h = biome.height();
        int[] out = new int[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                out[y * w + x] = opaque(biomeColor(biome.get(x, y)));
            }
        }
        return out;
    }

    public static int biomeColor(BiomeType b) {
        return switch (b) {
            case SEA -> DARKBLUE;
            case SEA_ICE -> LIGHTBLUE;
            case POLAR -> 0xF0F8FF;              // ALICEBLUE
            case TUNDRA -> 0xB0C4DE;             // LIGHTSTEELBLUE
            case LICHEN_WOODLAND -> 0x8FBC8F;    // DARKSEAGREEN
            case CONIFEROUS_FOREST -> DARKGREEN;
            case MIXED_FOREST -> 0x228B22;       // FORESTGREEN
            case DECIDUOUS_FOREST -> 0x6B8E23;   // OLIVEDRAB
            case STEPPE -> 0xF0E68C;             // KHAKI
            case COLD_DESERT -> 0xD2B48C;        // TAN
            case SHRUBLAND -> 0xBDB76B;          // DARKKHAKI
            case HOT_DESERT -> SANDYBROWN;
            case SAVANNA -> YELLOWGREEN;
            case MONSOON_FOREST -> 0x3CB371;     // MEDIUMSEAGREEN
            case RAIN_FOREST -> 0x2E8B57;        // SEAGREEN
            case NONE -> 0xA9A9A9;               // DARKGRAY
        };
    }

    private int[] ramp(FloatGrid grid, DoubleToIntFunction color) {
        int w = grid.width();
        int h = grid.height();
        int[] out = new int[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                out[y * w + x] = opaque(color.applyAsInt(grid.get(x, y)));
            }
        }
        return out;
    }

    private static int landColor(double n) {
        if (n < 0.4) return lerp(GREEN, YELLOWGREEN, n / 0.4);
        if (n < 0.8) return lerp(YELLOWGREEN, SADDLEBROWN, (n - 0.4) / 0.4);
        return lerp(SADDLEBROWN, WHITE, (n - 0.8) / 0.2);
    }

    private static int temperatureColor(double n) {
        if (n < 0.35) return lerp(DARKBLUE, LIGHTBLUE, n / 0.35);
        if (n < 0.55) return lerp(LIGHTBLUE, WHITE, (n - 0.35) / 0.2);
        if (n < 0.75) return lerp(WHITE, GOLD, (n - 0.55) / 0.2);
        return lerp(GOLD, RED, (n - 0.75) / 0.25);
    }

    private static int moistureColor(double n) {
        if (n < 0.25) return lerp(SANDYBROWN, YELLOWGREEN, n / 0.25);
        if (n < 0.6) return lerp(YELLOWGREEN, GREEN, (n - 0.25) / 0.35);
        return lerp(GREEN, DARKGREEN, (n - 0.6) / 0.4);
    }

    /** Освещённость в [0,1] по центральным разностям. Долгота замкнута, по широте край обрезается. */
    double hillshade(FloatGrid e, int x, int y) {
        int w = e.width();
        int h = e.height();
        double left = e.get((x - 1 + w) % w, y);
        double right = e.get((x + 1) % w, y);
        double up = e.get(x, Math.max(0, y - 1));
        double down = e.get(x, Math.min(h - 1, y + 1));
        // рельеф нормирован, растягиваем уклоны по размеру сетки
        double scale = h * 0.5;
        double dzdx = (right - left) * scale;
        double dzdy = (down - up) * scale;
        double slope = Math.atan(Math.hypot(dzdx, dzdy));
        double aspect = Math.atan2(dzdy, -dzdx);
        double zenith = Math.PI / 2 - LIGHT_ALTITUDE;
        double lit = Math.cos(zenith) * Math.cos(slope)
                + Math.sin(zenith) * Math.sin(slope) * Math.cos(LIGHT_AZIMUTH - aspect);
        return clamp01(lit);
    }

    private int shade(int rgb, double light) {
        double k = 1.0 - shadeStrength + shadeStrength * light;
        int r = (int) Math.round(((rgb >> 16) & 0xFF) * k);
        int g = (int) Math.round(((rgb >> 8) & 0xFF) * k);
        int b = (int) Math.round((rgb & 0xFF) * k);
        return (clamp255(r) << 16) | (clamp255(g) << 8) | clamp255(b);
    }

    private static int lerp(int a, int b, double t) {
        t = clamp01(t);
        int r = (int) Math.round(((a >> 16) & 0xFF) + (((b >> 16) & 0xFF) - ((a >> 16) & 0xFF)) * t);
        int g = (int) Math.round(((a >> 8) & 0xFF) + (((b >> 8) & 0xFF) - ((a >> 8) & 0xFF)) * t);
        int bl = (int) Math.round((a & 0xFF) + ((b & 0xFF) - (a & 0xFF)) * t);
        return (r << 16) | (g << 8) | bl;
    }

    private static double norm(double v, double min, double max) {
        if (max - min < 1e-12) return 0.5;
        return clamp01((v - min) / (max - min));
    }

    private static double clamp01(double v) {
        return v < 0 ? 0 : (v > 1 ? 1 : v);
    }

    private static int clamp255(int v) {
        return v < 0 ? 0 : Math.min(255, v);
    }

    private static int opaque(int rgb) {
        return 0xFF000000 | rgb;
    }
}
