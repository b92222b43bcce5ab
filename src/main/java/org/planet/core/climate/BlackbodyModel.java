package org.planet.core.climate;

/**
 * Equilibrium temperature from stellar flux alone, no atmosphere. Supplied from outside
 * the climate core; {@link StellarBlackbody} is the stock implementation.
 */
public interface BlackbodyModel {

    /** K at the given true anomaly. */
    double temperatureAt(double trueAnomaly);

    /** K at the average orbital distance. */
    double averageTemperature();

    double periapsisTemperature();

    double apoapsisTemperature();
}
