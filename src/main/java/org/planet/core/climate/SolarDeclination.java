package org.planet.core.climate;

/** Angle of the sub-solar point north of the equator at a true anomaly, radians. */
@FunctionalInterface
public interface SolarDeclination {

    double declinationAt(double trueAnomaly);
}
