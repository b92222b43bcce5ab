package org.planet.core.model;

/**
 * Keplerian orbit around the host star. True anomaly is supplied by callers;
 * ephemeris is not computed here.
 *
 * @param semiMajorAxis m
 * @param eccentricity  [0,1)
 * @param inclination   radians, relative to the star's equator
 */
public record Orbit(double semiMajorAxis, double eccentricity, double inclination) {

    public Orbit {
        if (!(semiMajorAxis > 0)) {
            throw new IllegalArgumentException("semiMajorAxis must be > 0: " + semiMajorAxis);
        }
        if (!(eccentricity >= 0 && eccentricity < 1)) {
            throw new IllegalArgumentException("eccentricity must be in [0,1): " + eccentricity);
        }
    }

    public double periapsis() {
        return semiMajorAxis * (1 - eccentricity);
    }

    public double apoapsis() {
        return semiMajorAxis * (1 + eccentricity);
    }

    public double averageDistance() {
        return (periapsis() + apoapsis()) / 2;
    }

    /** Distance from the star at the given true anomaly. */
    public double distanceAt(double trueAnomaly) {
        return semiMajorAxis * (1 - eccentricity * eccentricity) / (1 + eccentricity * Math.cos(trueAnomaly));
    }
}
