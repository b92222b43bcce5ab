package org.planet.core.climate;

import org.planet.core.geometry.SurfaceGeometry;
import org.planet.core.model.Atmosphere;
import org.planet.core.model.Planet;

/**
 * Surface temperature from blackbody temperature, latitude-dependent insolation,
 * greenhouse warming and the lapse rate. All per-planet factors are computed once
 * in the constructor.
 */
public class TemperatureModel {

    public static final double DEFAULT_COS_POLAR_LATITUDE = 0.095;
    /** c in {@code cos(|latitude| * c)}, the weight of the equatorial insolation factor. */
    public static final double DEFAULT_INSOLATION_COSINE = 0.8;

    private final Planet planet;
    private final BlackbodyModel blackbody;
    private final SolarDeclination declination;

    private final double averageBlackbody;
    private final double insolationEquatorial;
    private final double insolationPolar;
    private final double greenhouseEffect;
    private final double lapseRateDry;
    private final double diurnalVariation;
    private final double insolationCosine;

    public TemperatureModel(Planet planet) {
        this(planet, new StellarBlackbody(planet), new OrbitalDeclination(planet),
                DEFAULT_COS_POLAR_LATITUDE, DEFAULT_INSOLATION_COSINE);
    }

    public TemperatureModel(Planet planet, BlackbodyModel blackbody, SolarDeclination declination,
                            double cosPolarLatitude, double insolationCosine) {
        this.planet = planet;
        this.blackbody = blackbody;
        this.declination = declination;
        this.insolationCosine = insolationCosine;

        this.averageBlackbody = blackbody.averageTemperature();
        Atmosphere atm = planet.atmosphere();
        if (atm == null) {
            this.insolationEquatorial = insolationFactor(0, 1, false, cosPolarLatitude);
            this.insolationPolar = insolationEquatorial;
        } else {
            this.insolationEquatorial = insolationFactor(atm.mass(), atm.scaleHeight(), false, cosPolarLatitude);
            this.insolationPolar = insolationFactor(atm.mass(), atm.scaleHeight(), true, cosPolarLatitude);
        }
        double greenhouseFactor = atm == null ? 0.0 : atm.greenhouseFactor();
        this.greenhouseEffect = Math.max(0.0,
                averageBlackbody * insolationEquatorial * greenhouseFactor - averageBlackbody);
        this.lapseRateDry = planet.surfaceGravity() / ClimateConstants.CP_DRY_AIR;

        double timeFactor = clamp(1 - (planet.rotationalPeriod() - 2_500) / 595_000, 0, 1);
        double dark = averageBlackbody * insolationEquatorial * timeFactor + greenhouseEffect;
        this.diurnalVariation = averageSurfaceTemperature() - dark;
    }

    /**
     * Multiplier on blackbody temperature for the atmosphere column. With no atmosphere
     * mass there is no atmospheric term and the factor is 1.
     */
    double insolationFactor(double atmosphereMass, double scaleHeight, boolean polar, double cosPolarLatitude) {
        if (atmosphereMass <= 0) {
            return 1.0;
        }
        double transmission = polar
                ? Math.pow(0.7, Math.pow(polarAirMass(scaleHeight, cosPolarLatitude), 0.678))
                : 0.7;
        return Math.pow(1_320_000 * atmosphereMass * transmission / planet.mass(), 0.25);
    }

    /** Relative air mass the sun's rays cross at the polar circle. */
    double polarAirMass(double scaleHeight, double cosPolarLatitude) {
        double r = planet.radius() / scaleHeight;
        double rCosLat = r * cosPolarLatitude;
        return Math.sqrt(rCosLat * rCosLat + 2 * r + 1) - rCosLat;
    }

    /**
     * Insolation factor at a latitude: the polar factor plus the equatorial excess
     * weighted by {@code cos(|latitude| * c)}.
     */
    public double insolationFactor(double latitude) {
        double weight = Math.cos(Math.abs(latitude) * insolationCosine);
        return insolationPolar + (insolationEquatorial - insolationPolar) * weight;
    }

    /**
     * Angular distance of a latitude from the sub-solar parallel, folded back over the poles.
     * A positive declination (northern summer) moves northern latitudes toward the equator.
     */
    public static double seasonalLatitude(double latitude, double solarDeclination) {
        return SurfaceGeometry.reflectLatitude(latitude - solarDeclination);
    }

    public double seasonalLatitudeAt(double latitude, double trueAnomaly) {
        return seasonalLatitude(latitude, declination.declinationAt(trueAnomaly));
    }

    /** Surface temperature before elevation adjustment, K. */
    public double surfaceTemperatureAt(double trueAnomaly, double seasonalLatitude) {
        return blackbody.temperatureAt(trueAnomaly) * insolationFactor(seasonalLatitude) + greenhouseEffect;
    }

    public double temperatureAtElevation(double surfaceTemp, double elevation) {
        Atmosphere atm = planet.atmosphere();
        if (atm == null) {
            return surfaceTemp;
        }
        if (elevation >= atm.atmosphericHeight()) {
            return averageBlackbody;
        }
        if (elevation <= 0) {
            return surfaceTemp;
        }
        return Math.max(0.0, surfaceTemp - elevation * lapseRate(surfaceTemp));
    }

    /** K per meter; moist adiabatic when the air carries water vapor. */
    public double lapseRate(double surfaceTemp) {
        Atmosphere atm = planet.atmosphere();
        if (atm == null || !atm.hasWaterVapor()) {
            return lapseRateDry;
        }
        double w = atm.waterVaporRatio();
        double t2 = surfaceTemp * surfaceTemp;
        double rsd = ClimateConstants.R_SPECIFIC_DRY_AIR;
        double hv = ClimateConstants.DELTA_HVAP_WATER;
        double epsilon = rsd / ClimateConstants.R_SPECIFIC_WATER;

        double numerator = rsd * t2 + hv * w * surfaceTemp;
        double denominator = ClimateConstants.CP_DRY_AIR * rsd * t2 + hv * hv * w * epsilon;
        if (Math.abs(denominator) < 1e-12) {
            return lapseRateDry;
        }
        return planet.surfaceGravity() * (numerator / denominator);
    }

    /** Temperature at a true anomaly, latitude and elevation (m), K. */
    public double temperatureAt(double trueAnomaly, double latitude, double elevation) {
        return temperatureAtElevation(
                surfaceTemperatureAt(trueAnomaly, seasonalLatitudeAt(latitude, trueAnomaly)), elevation);
    }

    /** Temperatures at the northern winter and summer solstices at a latitude and elevation (m). */
    public SolsticeTemperature solsticeTemperatureAt(double latitude, double elevation) {
        return new SolsticeTemperature(
                temperatureAt(planet.winterSolsticeTrueAnomaly(), latitude, elevation),
                temperatureAt(planet.summerSolsticeTrueAnomaly(), latitude, elevation));
    }

    public TemperatureRange temperatureRangeAt(double latitude, double elevation) {
        return solsticeTemperatureAt(latitude, elevation).range();
    }

    /** Start of season {@code index} of {@code seasons}, as a proportion of the year from the winter solstice. */
    public static double seasonProportion(int index, int seasons) {
        return (double) index / seasons;
    }

    /** 0 at the winter solstice, 1 at the summer solstice. */
    public static double proportionOfSummer(double proportionOfYear) {
        return 1 - Math.abs(0.5 - proportionOfYear) / 0.5;
    }

    public double seasonTrueAnomaly(int index, int seasons) {
        double a = planet.winterSolsticeTrueAnomaly() + SurfaceGeometry.TWO_PI * seasonProportion(index, seasons);
        return a % SurfaceGeometry.TWO_PI;
    }

    /** Temperature during a season, interpolated from the winter toward the summer solstice value. */
    public static double seasonTemperature(SolsticeTemperature solstices, int index, int seasons) {
        return solstices.lerp(proportionOfSummer(seasonProportion(index, seasons)));
    }

    public static double seasonTemperature(double winter, double summer, int index, int seasons) {
        return seasonTemperature(new SolsticeTemperature(winter, summer), index, seasons);
    }

    public double averageBlackbodyTemperature() { return averageBlackbody; }
    public double insolationFactorEquatorial() { return insolationEquatorial; }
    public double insolationFactorPolar() { return insolationPolar; }
    public double greenhouseEffect() { return greenhouseEffect; }
    public double lapseRateDry() { return lapseRateDry; }
    public double diurnalTemperatureVariation() { return diurnalVariation; }
    public double insolationCosine() { return insolationCosine; }

    public double averageSurfaceTemperature() {
        return averageBlackbody * insolationEquatorial + greenhouseEffect;
    }

    public double averagePolarSurfaceTemperature() {
        return averageBlackbody * insolationPolar + greenhouseEffect;
    }

    public double maxSurfaceTemperature() {
        return blackbody.periapsisTemperature() * insolationEquatorial + greenhouseEffect;
    }

    public double minSurfaceTemperature() {
        return Math.max(0.0, blackbody.apoapsisTemperature() * insolationPolar + greenhouseEffect - diurnalVariation);
    }

    public Planet planet() {
        return planet;
    }

    private static double clamp(double v, double lo, double hi) {
        return v < lo ? lo : (v > hi ? hi : v);
    }
}
