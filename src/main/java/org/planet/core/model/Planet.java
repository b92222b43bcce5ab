package org.planet.core.model;

import org.planet.core.geometry.SurfaceGeometry;
import org.planet.core.model.config.PlanetParams;

import java.util.Arrays;

/**
 * Immutable planet. Derived quantities (gravity, max elevation, sea level, tilt,
 * solstice anomalies, axis geometry) are computed once in the constructor.
 */
public final class Planet {

    public static final double GRAVITATIONAL_CONSTANT = 6.674_30e-11;
    /** Max elevation numerator: maxElevation = K / surfaceGravity. */
    public static final double MAX_ELEVATION_K = 200_000.0;
    public static final double ELEVATION_EPSILON = 1e-9;

    private final String id;
    private final PlanetKind kind;
    private final double radius;
    private final double mass;
    private final double albedo;
    private final double rotationalPeriod;
    private final double angleOfRotation;
    private final double axialPrecession;
    private final Orbit orbit;
    private final double starLuminosity;
    private final double stellarDistance;
    private final Atmosphere atmosphere;
    private final boolean flatSurface;
    private final double maxElevationFactor;
    private final double normalizedSeaLevel;
    private final double hydrosphereProportion;
    private final int[] seeds;

    // derived
    private final double surfaceGravity;
    private final double maxElevation;
    private final double seaLevel;
    private final double axialTilt;
    private final double summerSolsticeTrueAnomaly;
    private final double winterSolsticeTrueAnomaly;
    private final SurfaceGeometry geometry;

    public Planet(PlanetParams p) {
        this.id = (p.id == null || p.id.isBlank()) ? defaultId(p.seeds) : p.id;
        this.kind = p.kind;
        this.radius = p.radius;
        this.mass = p.mass;
        this.albedo = p.albedo;
        this.rotationalPeriod = p.rotationalPeriod;
        this.angleOfRotation = p.angleOfRotation;
        this.axialPrecession = p.axialPrecession;
        this.orbit = p.orbit;
        this.starLuminosity = p.starLuminosity;
        this.stellarDistance = p.stellarDistance;
        this.atmosphere = p.atmosphere;
        this.flatSurface = p.flatSurface || p.kind.flatSurface;
        this.maxElevationFactor = p.maxElevationFactor;
        this.normalizedSeaLevel = p.normalizedSeaLevel;
        this.hydrosphereProportion = p.hydrosphereProportion;
        this.seeds = p.seeds.clone();

        this.surfaceGravity = GRAVITATIONAL_CONSTANT * mass / (radius * radius);
        this.maxElevation = computeMaxElevation(p);
        this.seaLevel = normalizedSeaLevel * maxElevation;
        this.axialTilt = orbit != null ? angleOfRotation - orbit.inclination() : angleOfRotation;
        this.summerSolsticeTrueAnomaly = positiveAngle(axialPrecession + Math.PI / 2);
        this.winterSolsticeTrueAnomaly = positiveAngle(axialPrecession + Math.PI * 1.5);
        this.geometry = new SurfaceGeometry(radius, angleOfRotation, axialPrecession);
    }

    /** Gravity-derived max elevation (0 for flat bodies). */
    public static double computeMaxElevation(PlanetParams p) {
        if (p.flatSurface || (p.kind != null && p.kind.flatSurface)) return 0.0;
        double g = GRAVITATIONAL_CONSTANT * p.mass / (p.radius * p.radius);
        if (!(g > 0)) return 0.0;
        return MAX_ELEVATION_K / g * p.maxElevationFactor;
    }

    /**
     * Same planet with a different max elevation. The absolute sea level is rescaled so
     * that its normalized value stays the same.
     */
    public Planet withMaxElevation(double meters) {
        PlanetParams p = PlanetParams.from(this);
        double base = computeMaxElevation(p.maxElevationFactor(1.0));
        p.maxElevationFactor = base < ELEVATION_EPSILON ? 0.0 : meters / base;
        return p.build();
    }

    /** Same planet with the given absolute sea level (m); the normalized value follows. */
    public Planet withSeaLevel(double meters) {
        return PlanetParams.from(this).seaLevel(meters).build();
    }

    private static String defaultId(int[] seeds) {
        return "planet-" + Integer.toHexString(Arrays.hashCode(seeds));
    }

    private static double positiveAngle(double a) {
        double r = a % (Math.PI * 2);
        return r < 0 ? r + Math.PI * 2 : r;
    }

    public String id() { return id; }
    public PlanetKind kind() { return kind; }
    public double radius() { return radius; }
    public double mass() { return mass; }
    public double density() { return mass / (4.0 / 3.0 * Math.PI * radius * radius * radius); }
    public double albedo() { return albedo; }
    public double rotationalPeriod() { return rotationalPeriod; }
    public double angleOfRotation() { return angleOfRotation; }
    public double axialPrecession() { return axialPrecession; }
    public double axialTilt() { return axialTilt; }
    /** May be null for a body that is not in orbit. */
    public Orbit orbit() { return orbit; }
    public boolean hasOrbit() { return orbit != null; }
    public double starLuminosity() { return starLuminosity; }
    public double stellarDistance() { return stellarDistance; }
    /** May be null for an airless body. */
    public Atmosphere atmosphere() { return atmosphere; }
    public boolean hasAtmosphere() { return atmosphere != null; }
    public boolean hasFlatSurface() { return flatSurface; }
    public double maxElevationFactor() { return maxElevationFactor; }
    public double normalizedSeaLevel() { return normalizedSeaLevel; }
    public double hydrosphereProportion() { return hydrosphereProportion; }
    public boolean hasHydrosphere() { return hydrosphereProportion > 0; }
    public int[] seeds() { return seeds.clone(); }
    public int seed(int index) { return seeds[index]; }
    public int seedCount() { return seeds.length; }
    public double surfaceGravity() { return surfaceGravity; }
    public double maxElevation() { return maxElevation; }
    public double seaLevel() { return seaLevel; }
    public double summerSolsticeTrueAnomaly() { return summerSolsticeTrueAnomaly; }
    public double winterSolsticeTrueAnomaly() { return winterSolsticeTrueAnomaly; }
    public SurfaceGeometry geometry() { return geometry; }

    @Override
    public String toString() {
        return "Planet{id=" + id + ", kind=" + kind + ", radius=" + radius + ", g=" + surfaceGravity
                + ", maxElevation=" + maxElevation + ", seeds=" + Arrays.toString(seeds) + "}";
    }
}
