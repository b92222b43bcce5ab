package org.planet.core.climate;

import org.planet.core.geometry.Vector3;
import org.planet.core.model.Atmosphere;
import org.planet.core.model.Planet;
import org.planet.core.noise.NoiseField;

/**
 * Precipitation and snowfall per location and season: a broad noise field times a
 * fine one, plus the Hadley curve by seasonal latitude, gated by temperature and
 * scaled by the planet's precipitation budget.
 */
public class PrecipitationModel {

    public static final double DEFAULT_ITCZ_MAX_BOOST = 1.4;
    /** Unit-sphere coordinates are scaled by this before sampling. */
    public static final double COORDINATE_SCALE = 1000.0;
    /** Inter-tropical convergence zone half-width. */
    public static final double ITCZ_LATITUDE = Math.PI / 16;

    private final Atmosphere atmosphere;
    private final HadleyCache hadley;
    private final NoiseField detail;
    private final NoiseField smooth;
    private final double itczMaxBoost;

    public PrecipitationModel(Planet planet, HadleyCache hadley) {
        this(planet, hadley, DEFAULT_ITCZ_MAX_BOOST);
    }

    public PrecipitationModel(Planet planet, HadleyCache hadley, double itczMaxBoost) {
        if (planet.atmosphere() == null) {
            throw new IllegalArgumentException("Precipitation requires an atmosphere (planet " + planet.id() + ")");
        }
        if (itczMaxBoost < 1) {
            throw new IllegalArgumentException("itczMaxBoost must be >= 1: " + itczMaxBoost);
        }
        this.atmosphere = planet.atmosphere();
        this.hadley = hadley;
        this.itczMaxBoost = itczMaxBoost;
        this.detail = NoiseField.fractal(precipitationSeed(planet, 3), 3);
        this.smooth = NoiseField.simplex(precipitationSeed(planet, 4));
    }

    /** Seeds 4 and 5 when present; planets with only three seeds derive them from the first. */
    static int precipitationSeed(Planet planet, int index) {
        if (planet.seedCount() > index) {
            return planet.seed(index);
        }
        return planet.seed(0) * 31 + index * 7_919;
    }

    /**
     * Relative humidity (>= 0) before the budget is applied.
     *
     * @param temperature K, for the season
     */
    public double relativeHumidityAt(Vector3 position, double seasonalLatitude, double temperature) {
        double x = position.x * COORDINATE_SCALE;
        double y = position.y * COORDINATE_SCALE;
        double z = position.z * COORDINATE_SCALE;

        double r1 = 0.3 + 0.7 * smooth.sample(x, y, z);
        double r2 = 0.9 + 0.1 * detail.sample(x, y, z);
        double r = r1 * r2;

        double lat = HadleyCache.roundedAbsLatitude(seasonalLatitude);
        double humidity = Math.max(0.0, r + hadley.valueAt(lat));

        humidity *= clamp((temperature - ClimateConstants.LOW_TEMPERATURE) / 16, 0, 1);

        if (lat < ITCZ_LATITUDE && humidity > 0) {
            humidity *= clamp(1 + (r2 - 0.9) * 4, 1, itczMaxBoost);
        }
        return humidity;
    }

    /**
     * @param temperature      K, for the season
     * @param proportionOfYear share of the year the season covers
     */
    public Precipitation precipitationAt(Vector3 position, double seasonalLatitude,
                                         double temperature, double proportionOfYear) {
        double humidity = relativeHumidityAt(position, seasonalLatitude, temperature);
        if (humidity <= 0) {
            return Precipitation.NONE;
        }
        double precipitation = atmosphere.averagePrecipitation() * proportionOfYear * humidity;
        return new Precipitation(precipitation, snowFrom(precipitation, temperature));
    }

    /** Snow only at or below freezing. */
    public double snowFrom(double precipitation, double temperature) {
        return temperature <= ClimateConstants.FREEZING_POINT
                ? precipitation * atmosphere.snowToRainRatio()
                : 0.0;
    }

    private static double clamp(double v, double lo, double hi) {
        return v < lo ? lo : (v > hi ? hi : v);
    }
}
