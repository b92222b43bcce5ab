package org.planet.core.climate;

/**
 * Seasonal sea-ice and snow-cover windows from a cell's temperature range.
 */
public final class CoverRanges {

    private CoverRanges() {}

    public static CoverRange seaIce(TemperatureRange range, double latitude, double elevation, boolean hasHydrosphere) {
        if (!hasHydrosphere || elevation > 0) {
            return CoverRange.NONE;
        }
        return window(range, latitude, false);
    }

    public static CoverRange snowCover(TemperatureRange range, double latitude, double elevation,
                                       HumidityType humidity, boolean hasHydrosphere) {
        if ((hasHydrosphere && elevation <= 0) || humidity.atMost(HumidityType.PERARID)) {
            return CoverRange.NONE;
        }
        return window(range, latitude, true);
    }

    private static CoverRange window(TemperatureRange range, double latitude, boolean snow) {
        double melt = ClimateConstants.SALT_WATER_MELTING_POINT;
        if (range.min() > melt) {
            return CoverRange.NONE;
        }
        if (range.max() < melt) {
            return CoverRange.FULL_YEAR;
        }

        double freezeProportion = inverseLerp(range.min(), range.max(), melt);
        if (Double.isNaN(freezeProportion)) {
            return CoverRange.NONE;
        }
        // freezes longer than it thaws: never fully melts
        if (freezeProportion >= 0.5) {
            return CoverRange.FULL_YEAR;
        }

        double meltFinish = snow ? freezeProportion * 3 / 4 : freezeProportion;
        double freezeStart = 1 - freezeProportion / 2;
        if (latitude < 0) {
            meltFinish += 0.5;
            if (meltFinish > 1) meltFinish -= 1;
            freezeStart -= 0.5;
        }
        return new CoverRange(freezeStart, meltFinish);
    }

    static double inverseLerp(double a, double b, double v) {
        if (a == b) return Double.NaN;
        return (v - a) / (b - a);
    }
}
