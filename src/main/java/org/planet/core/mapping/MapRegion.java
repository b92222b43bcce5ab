package org.planet.core.mapping;

import org.planet.core.geometry.SurfaceGeometry;

/**
 * Part of the surface a map covers, in radians. {@code range} is the latitude span;
 * the longitude span is twice that, so the full planet is {@code range = pi}.
 */
public record MapRegion(double centralMeridian, double centralParallel, double range) {

    public static final MapRegion FULL = new MapRegion(0.0, 0.0, Math.PI);

    public MapRegion {
        if (!(range > 0) || range > Math.PI) {
            throw new IllegalArgumentException("Region range must be in (0, pi]: " + range);
        }
        if (!Double.isFinite(centralMeridian) || !Double.isFinite(centralParallel)) {
            throw new IllegalArgumentException("Region centre must be finite");
        }
        double half = range / 2;
        // small tolerance so that FULL with any rounding still passes
        if (centralParallel + half > SurfaceGeometry.HALF_PI + 1e-12
                || centralParallel - half < -SurfaceGeometry.HALF_PI - 1e-12) {
            throw new IllegalArgumentException("Region crosses a pole: centralParallel="
                    + centralParallel + " range=" + range);
        }
        centralMeridian = SurfaceGeometry.normalizeLongitude(centralMeridian);
    }

    public double northLatitude() {
        return Math.min(SurfaceGeometry.HALF_PI, centralParallel + range / 2);
    }

    public double southLatitude() {
        return Math.max(-SurfaceGeometry.HALF_PI, centralParallel - range / 2);
    }

    public double westLongitude() {
        return centralMeridian - range;
    }

    public double longitudeSpan() {
        return range * 2;
    }

    public boolean isFullPlanet() {
        return range >= Math.PI;
    }
}
