package org.planet.core.terrain;

import org.planet.core.geometry.SurfaceGeometry;
import org.planet.core.geometry.Vector3;
import org.planet.core.model.Planet;
import org.planet.core.noise.NoiseField;

/**
 * Terrain height from three independently seeded noise fields. The base field is
 * modulated by the magnitudes of two irregularity fields so that relief clusters
 * instead of covering the sphere evenly.
 */
public class ElevationModel {

    public static final double DEFAULT_MULTIPLIER = 6.0;
    /** Unit-sphere coordinates are scaled by this before sampling. */
    public static final double COORDINATE_SCALE = 100.0;

    private final Planet planet;
    private final SurfaceGeometry geometry;
    private final NoiseField base;
    private final NoiseField irregularity1;
    private final NoiseField irregularity2;
    private final double multiplier;

    public ElevationModel(Planet planet) {
        this(planet, DEFAULT_MULTIPLIER);
    }

    public ElevationModel(Planet planet, double multiplier) {
        this.planet = planet;
        this.geometry = planet.geometry();
        this.base = NoiseField.fractal(planet.seed(0), 6);
        this.irregularity1 = NoiseField.fractal(planet.seed(1), 5);
        this.irregularity2 = NoiseField.fractal(planet.seed(2), 4);
        this.multiplier = multiplier;
    }

    public Planet planet() {
        return planet;
    }

    /**
     * Sea-level-relative elevation as a fraction of max elevation, clamped to [-1, 1].
     * Always 0 on a body without relief.
     */
    public double normalizedElevationAt(Vector3 position) {
        if (planet.maxElevation() < Planet.ELEVATION_EPSILON) {
            return 0.0;
        }
        double x = position.x * COORDINATE_SCALE;
        double y = position.y * COORDINATE_SCALE;
        double z = position.z * COORDINATE_SCALE;

        double e = base.sample(x, y, z);
        double irr1 = Math.abs(irregularity1.sample(x, y, z));
        double irr2 = Math.abs(irregularity2.sample(x, y, z));

        double v = multiplier * e * irr1 * irr2 - planet.normalizedSeaLevel();
        return clamp(v, -1.0, 1.0);
    }

    public double normalizedElevationAt(double latitude, double longitude) {
        return normalizedElevationAt(geometry.latLonToVector(latitude, longitude));
    }

    /** Elevation in meters relative to sea level. */
    public double elevationAt(double latitude, double longitude) {
        return normalizedElevationAt(latitude, longitude) * planet.maxElevation();
    }

    public double elevationAt(Vector3 position) {
        return normalizedElevationAt(position) * planet.maxElevation();
    }

    /**
     * Steepest rise/run towards the four neighbours one arc-second away
     * (north, east, south, west), wrapping over the poles and the antimeridian.
     */
    public double slopeAt(double latitude, double longitude) {
        if (planet.maxElevation() < Planet.ELEVATION_EPSILON) {
            return 0.0;
        }
        Vector3 center = geometry.latLonToVector(latitude, longitude);
        double e = normalizedElevationAt(center);

        double[][] neighbours = {
                SurfaceGeometry.offsetNorth(latitude, longitude, SurfaceGeometry.ARC_SECOND),
                SurfaceGeometry.offsetEast(latitude, longitude, SurfaceGeometry.ARC_SECOND),
                SurfaceGeometry.offsetNorth(latitude, longitude, -SurfaceGeometry.ARC_SECOND),
                SurfaceGeometry.offsetEast(latitude, longitude, -SurfaceGeometry.ARC_SECOND)
        };

        double max = 0.0;
        for (double[] c : neighbours) {
            Vector3 other = geometry.latLonToVector(c[0], c[1]);
            double run = geometry.greatCircleDistance(center, other);
            if (run < 1e-9) continue; // east/west offsets collapse at a pole
            double rise = Math.abs(normalizedElevationAt(other) - e) * planet.maxElevation();
            max = Math.max(max, rise / run);
        }
        return max;
    }

    public boolean isMountainous(double latitude, double longitude) {
        double e = normalizedElevationAt(latitude, longitude);
        if (e < 0.035) return false;
        if (e > 0.085) return true;
        double slope = slopeAt(latitude, longitude);
        if (e > 0.05) return slope > 0.035;
        return slope > 0.0875;
    }

    private static double clamp(double v, double lo, double hi) {
        return v < lo ? lo : (v > hi ? hi : v);
    }
}
