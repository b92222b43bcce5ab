package org.planet.core.climate;

import org.planet.core.model.Orbit;
import org.planet.core.model.Planet;

/**
 * T = (L (1 - albedo) / (4 pi sigma d^2))^0.25, scaled by how much of the surface
 * effectively shares the absorbed flux (depends on rotational period).
 */
public class StellarBlackbody implements BlackbodyModel {

    private final double luminosity;
    private final double albedo;
    private final Orbit orbit;
    private final double fixedDistance;
    private final double areaFactor;

    public StellarBlackbody(Planet planet) {
        this.luminosity = planet.starLuminosity();
        this.albedo = planet.albedo();
        this.orbit = planet.orbit();
        this.fixedDistance = planet.stellarDistance();
        this.areaFactor = Math.pow(areaRatio(planet.rotationalPeriod()), 0.25);
    }

    /**
     * Fraction of the sphere the flux is averaged over, by rotational period (s).
     * Very fast and very slow rotators both keep the full factor.
     */
    public static double areaRatio(double rotationalPeriod) {
        if (rotationalPeriod <= 2_500) return 1.0;
        if (rotationalPeriod <= 75_000) return 0.25;
        if (rotationalPeriod <= 150_000) return 1.0 / 3.0;
        if (rotationalPeriod <= 300_000) return 0.5;
        return 1.0;
    }

    public double temperatureAtDistance(double distance) {
        if (luminosity <= 0 || !(distance > 0)) return 0.0;
        double flux = luminosity * (1 - albedo)
                / (4 * Math.PI * ClimateConstants.STEFAN_BOLTZMANN * distance * distance);
        return Math.pow(flux, 0.25) * areaFactor;
    }

    @Override
    public double temperatureAt(double trueAnomaly) {
        return temperatureAtDistance(orbit == null ? fixedDistance : orbit.distanceAt(trueAnomaly));
    }

    @Override
    public double averageTemperature() {
        return temperatureAtDistance(orbit == null ? fixedDistance : orbit.averageDistance());
    }

    @Override
    public double periapsisTemperature() {
        return temperatureAtDistance(orbit == null ? fixedDistance : orbit.periapsis());
    }

    @Override
    public double apoapsisTemperature() {
        return temperatureAtDistance(orbit == null ? fixedDistance : orbit.apoapsis());
    }
}
