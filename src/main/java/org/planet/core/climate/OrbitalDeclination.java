package org.planet.core.climate;

import org.planet.core.model.Planet;

/**
 * Declination from axial tilt and the ecliptic longitude of the sun
 * ({@code trueAnomaly - axialPrecession}, so the summer solstice sits at +tilt).
 */
public class OrbitalDeclination implements SolarDeclination {

    private final double axialTilt;
    private final double axialPrecession;
    private final boolean inOrbit;

    public OrbitalDeclination(Planet planet) {
        this.axialTilt = planet.axialTilt();
        this.axialPrecession = planet.axialPrecession();
        this.inOrbit = planet.hasOrbit();
    }

    @Override
    public double declinationAt(double trueAnomaly) {
        if (!inOrbit) return 0.0;
        double eclipticLongitude = trueAnomaly - axialPrecession;
        return Math.asin(Math.sin(axialTilt) * Math.sin(eclipticLongitude));
    }
}
